package org.github.dateretention;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.github.dateretention.impl.SnapshotDir;
import org.github.dateretention.logging.PolicyNameDiscriminator;
import org.github.dateretention.policy.RetentionConf;
import org.github.dateretention.policy.RetentionConf.ConfPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;

/**
 * Prints the snapshots a retention policy would prune, one per line. Nothing is deleted.
 *
 * <pre>
 * RetentionPrune [-c conf/retention.conf] policy|ALL [-]
 * </pre>
 *
 * With <code>-</code> the timestamps are read from standard input instead of the policy's snapshot directory.
 */
public class RetentionPrune
{
    protected static final Logger LOG=LoggerFactory.getLogger(RetentionPrune.class);

    public static void main(String[] args)
    {
        try
        {
            System.exit(new RetentionPrune().run(args, System.in, System.out));
        }
        catch (Exception ex)
        {
            LOG.error("Fatal error",ex);
            System.exit(1);
        }
    }

    public int run(String[] args, InputStream in, PrintStream out) throws IOException
    {
        File confFile=new File("conf","retention.conf");
        List<String> arguments=new ArrayList<>();
        for (int i=0;i<args.length;i++)
        {
            if ("-c".equals(args[i]) && i+1<args.length) confFile=new File(args[++i]);
            else arguments.add(args[i]);
        }

        if (arguments.isEmpty() || arguments.size()>2 || (arguments.size()==2 && !"-".equals(arguments.get(1))))
        {
            System.err.println("Usage: RetentionPrune [-c retention.conf] policy|ALL [-]");
            return 1;
        }

        configureLogging(confFile.getAbsoluteFile().getParentFile());

        LOG.debug("Reading {}",confFile);
        RetentionConf conf=RetentionConf.read(confFile);

        String policyName=arguments.get(0);
        boolean fromStdin=arguments.size()==2;

        if ("ALL".equals(policyName))
        {
            if (fromStdin) throw new IllegalArgumentException("Reading timestamps from stdin requires a single policy");
            for (ConfPolicy policy: conf.getAllPolicies())
            {
                printPruned(policy, listSnapshots(policy), out);
            }
        }
        else
        {
            ConfPolicy policy=conf.getPolicy(policyName);
            List<String> snapshots=fromStdin?readLines(in):listSnapshots(policy);
            printPruned(policy, snapshots, out);
        }
        out.flush();
        return 0;
    }

    protected void printPruned(ConfPolicy policy, List<String> snapshots, PrintStream out)
    {
        MDC.put(PolicyNameDiscriminator.KEY, policy.name);
        try
        {
            LOG.info("Applying policy {} to {} snapshots",policy.name,snapshots.size());
            for (String snapshot: policy.getRetentionPolicy().prune(snapshots))
            {
                out.println(snapshot);
            }
        }
        finally
        {
            MDC.remove(PolicyNameDiscriminator.KEY);
        }
    }

    protected List<String> listSnapshots(ConfPolicy policy) throws IOException
    {
        return new SnapshotDir(new File(policy.snapshotDir), policy.snapshotPattern).listSnapshots();
    }

    protected List<String> readLines(InputStream in) throws IOException
    {
        List<String> lines=new ArrayList<>();
        for (String line: IOUtils.readLines(in, StandardCharsets.UTF_8))
        {
            if (!line.trim().isEmpty()) lines.add(line);
        }
        return lines;
    }

    protected static void configureLogging(File confDir)
    {
        if (confDir==null) return;

        File loggerConf=new File(confDir,"logback.xml");
        if (!loggerConf.isFile()) return;

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try
        {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(loggerConf);
        }
        catch (JoranException je)
        {
          // StatusPrinter will handle this
        }
        StatusPrinter.printInCaseOfErrorsOrWarnings(context);
    }
}
