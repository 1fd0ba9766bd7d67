package tests;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.github.dateretention.RetentionPrune;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestRetentionPrune
{
    @Rule
    public TemporaryFolder folder=new TemporaryFolder();
    
    File confFile;
    
    @Before
    public void setUp() throws IOException
    {
        File hosts=folder.newFolder("hosts");
        File host=new File(hosts,"web");
        host.mkdir();
        new File(host,"backup-2017-12-30-12:00:00").mkdir();
        new File(host,"backup-2017-12-31-13:00:00").mkdir();
        new File(host,"backup-2017-12-31-12:00:00").mkdir();
        new File(host,"current").mkdir();
        
        confFile=new File(folder.getRoot(),"retention.conf");
        FileUtils.writeStringToFile(confFile,
                "defaults:\n"+
                "  timeZone: UTC\n"+
                "  referenceDate: 2018-01-01\n"+
                "  snapshotDir: "+hosts.getAbsolutePath()+"/${name}\n"+
                "policies:\n"+
                "  - name: web\n"+
                "    retain: [ 1d/7d ]\n",
                StandardCharsets.UTF_8);
    }
    
    String run(InputStream in, String... args) throws IOException
    {
        ByteArrayOutputStream out=new ByteArrayOutputStream();
        int exitCode=new RetentionPrune().run(args, in, new PrintStream(out, true, "UTF-8"));
        assertEquals(0, exitCode);
        return new String(out.toByteArray(), StandardCharsets.UTF_8).trim();
    }
    
    @Test
    public void testPrintsPrunedSnapshotsOfDirectory() throws IOException
    {
        assertEquals("backup-2017-12-31-13:00:00", run(null, "-c", confFile.getPath(), "web"));
        assertEquals("backup-2017-12-31-13:00:00", run(null, "-c", confFile.getPath(), "ALL"));
        
        // listing only
        assertEquals(4, new File(folder.getRoot(),"hosts/web").list().length);
    }
    
    @Test
    public void testReadsTimestampsFromStdin() throws IOException
    {
        InputStream in=new ByteArrayInputStream("2017-12-31 12:00:00\n2017-12-31 13:00:00\n\n2017-12-29 11:00:00\n".getBytes(StandardCharsets.UTF_8));
        
        assertEquals("2017-12-31 13:00:00", run(in, "-c", confFile.getPath(), "web", "-"));
    }
    
    @Test
    public void testUsage() throws IOException
    {
        assertEquals(1, new RetentionPrune().run(new String[0], null, System.out));
        assertEquals(1, new RetentionPrune().run(new String[] {"web", "extra"}, null, System.out));
    }
    
    @Test(expected=IllegalArgumentException.class)
    public void testStdinNeedsSinglePolicy() throws IOException
    {
        new RetentionPrune().run(new String[] {"-c", confFile.getPath(), "ALL", "-"}, new ByteArrayInputStream(new byte[0]), System.out);
    }
    
    @Test(expected=IllegalArgumentException.class)
    public void testUnknownPolicy() throws IOException
    {
        run(null, "-c", confFile.getPath(), "mail");
    }
}
