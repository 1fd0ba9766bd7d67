package tests.impl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.github.dateretention.impl.SnapshotDir;
import org.joda.time.LocalDateTime;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestSnapshotDir
{
    @Rule
    public TemporaryFolder folder=new TemporaryFolder();
    
    @Test
    public void testListsMatchingEntriesOldestFirst() throws IOException
    {
        File dir=folder.newFolder("host");
        new File(dir,"backup-2018-01-02-03:00:00").mkdir();
        new File(dir,"backup-2017-12-31-23:59:59").mkdir();
        new File(dir,"backup-2018-01-01-12:00:00").mkdir();
        new File(dir,"current").mkdir();
        new File(dir,".sync").mkdir();
        
        SnapshotDir snapshots=new SnapshotDir(dir);
        
        assertEquals(Arrays.asList("backup-2017-12-31-23:59:59", "backup-2018-01-01-12:00:00", "backup-2018-01-02-03:00:00"), snapshots.listSnapshots());
        assertEquals(new LocalDateTime(2018,1,1,12,0,0), snapshots.getSnapshotTime("backup-2018-01-01-12:00:00"));
        assertNull(snapshots.getSnapshotTime("current"));
        assertEquals("backup-2018-01-01-12:00:00", snapshots.getSnapshotName(new LocalDateTime(2018,1,1,12,0,0)));
    }
    
    @Test
    public void testCustomPatternSortsByTimeNotName() throws IOException
    {
        File dir=folder.newFolder("db");
        new File(dir,"dump_02.01.2018.sql").createNewFile();
        new File(dir,"dump_31.12.2017.sql").createNewFile();
        new File(dir,"dump_01.01.2018.sql").createNewFile();
        new File(dir,"readme.txt").createNewFile();
        
        SnapshotDir snapshots=new SnapshotDir(dir, "'dump_'dd.MM.yyyy'.sql'");
        
        assertEquals(Arrays.asList("dump_31.12.2017.sql", "dump_01.01.2018.sql", "dump_02.01.2018.sql"), snapshots.listSnapshots());
    }
    
    @Test(expected=IOException.class)
    public void testMissingDirectory() throws IOException
    {
        new SnapshotDir(new File(folder.getRoot(),"missing"));
    }
}
