package org.github.dateretention.impl;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A directory holding one entry per snapshot, named after the snapshot time.
 */
public class SnapshotDir
{
    protected Logger LOG=LoggerFactory.getLogger(getClass());

    public static final String DEFAULT_PATTERN="'backup-'yyyy-MM-dd-HH:mm:ss";

    protected final File snapshotDir;
    protected final DateTimeFormatter snapshotFormat;

    public SnapshotDir(File snapshotDir) throws IOException
    {
        this(snapshotDir, DEFAULT_PATTERN);
    }

    public SnapshotDir(File snapshotDir, String pattern) throws IOException
    {
        if (!snapshotDir.isDirectory()) throw new IOException("No such directory: "+snapshotDir.getAbsolutePath());
        this.snapshotDir=snapshotDir.getAbsoluteFile();
        this.snapshotFormat=DateTimeFormat.forPattern(pattern);
    }

    /**
     * @return the names of all entries that match the snapshot pattern, oldest first
     */
    public List<String> listSnapshots()
    {
        final Map<String,LocalDateTime> snapshots=new HashMap<>();

        File[] files=snapshotDir.listFiles();
        if (files!=null) for (File file: files)
        {
            LocalDateTime snapshot=getSnapshotTime(file.getName());
            if (snapshot!=null) snapshots.put(file.getName(),snapshot);
            else LOG.debug("Ignoring {}",file.getName());
        }

        List<String> names=new ArrayList<>(snapshots.keySet());
        Collections.sort(names, new Comparator<String>()
        {
            @Override
            public int compare(String a, String b)
            {
                int result=snapshots.get(a).compareTo(snapshots.get(b));
                return result!=0?result:a.compareTo(b);
            }
        });
        return names;
    }

    public LocalDateTime getSnapshotTime(String name)
    {
        try
        {
            return LocalDateTime.parse(name,snapshotFormat);
        }
        catch (IllegalArgumentException ex)
        {
            return null;
        }
    }

    public String getSnapshotName(LocalDateTime snapshot)
    {
        return snapshotFormat.print(snapshot);
    }
}
