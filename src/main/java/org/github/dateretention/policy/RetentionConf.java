package org.github.dateretention.policy;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.github.dateretention.keep.InvalidRuleException;
import org.joda.time.DateTimeZone;

import com.esotericsoftware.yamlbeans.YamlReader;

/**
 * YAML configuration with named retention policies:
 *
 * <pre>
 * defaults:
 *   timeZone: Europe/Berlin
 * policies:
 *   - name: db
 *     retain: [ 6h/3m, 1d/6m, 7d/9m ]
 *     autoSync: true
 * </pre>
 *
 * Unset policy fields are taken from <code>defaults</code>. String fields may refer to other fields of the
 * same policy, e.g. <code>snapshotDir: /backup/${name}</code>.
 */
public class RetentionConf
{
    public static RetentionConf read(File source) throws IOException
    {
        try (Reader in=new InputStreamReader(new FileInputStream(source),"utf-8"))
        {
            return read(in);
        }
    }

    public static RetentionConf read(Reader source) throws IOException
    {
        YamlReader reader=new YamlReader(source);

        try
        {
            RetentionConfHolder holder=reader.read(RetentionConfHolder.class);
            if (holder==null) holder=new RetentionConfHolder();

            RetentionConf conf=new RetentionConf();
            conf.policyMap=new LinkedHashMap<>();

            ConfPolicy policyDefaults=holder.defaults;
            if (policyDefaults==null) policyDefaults=createDefaultPolicyConf();
            else policyDefaults.applyDefaults(createDefaultPolicyConf());

            if (holder.policies!=null) for (ConfPolicy policyConf: holder.policies)
            {
                if (policyConf.name==null) throw new IllegalArgumentException("Policy without name in configuration");
                if (conf.policyMap.containsKey(policyConf.name)) throw new IllegalArgumentException("Duplicate policy "+policyConf.name);

                policyConf.applyDefaults(policyDefaults);
                resolvePlaceholders(policyConf);
                policyConf.initialize();
                conf.policyMap.put(policyConf.name,policyConf);
            }

            return conf;
        }
        finally
        {
            reader.close();
        }
    }

    protected static ConfPolicy createDefaultPolicyConf()
    {
        ConfPolicy conf=new ConfPolicy();
        conf.timeZone="UTC";
        conf.reachFactor=0.5;
        conf.autoSync=Boolean.FALSE;
        conf.snapshotDir="snapshots/${name}";
        conf.snapshotPattern="'backup-'yyyy-MM-dd-HH:mm:ss";
        return conf;
    }

    protected Map<String,ConfPolicy> policyMap;

    public List<ConfPolicy> getAllPolicies()
    {
        return new ArrayList<>(policyMap.values());
    }

    public ConfPolicy getPolicy(String name)
    {
        ConfPolicy policy=policyMap.get(name);
        if (policy == null) throw new IllegalArgumentException("No configuration for policy " + name);
        return policy;
    }

    protected static void resolvePlaceholders(Object o)
    {
        for (Field field: o.getClass().getFields())
        {
            if (field.getType()!=String.class) continue;

            try
            {
                String value=(String) field.get(o);
                if (value==null) continue;
                String newValue=resolvePlaceholders(value, o);

                if (!value.equals(newValue)) field.set(o,newValue);
            }
            catch (IllegalAccessException ex)
            {
                throw new IllegalStateException("Unable to resolve placeholders in "+field.getName(), ex);
            }
        }
    }

    protected static String getPropertyAsString(Object o, String name)
    {
        try
        {
            Object result=o.getClass().getField(name).get(o);
            if (result==null) return null;
            return result.toString();
        }
        catch (NoSuchFieldException | IllegalAccessException ex)
        {
            return null;
        }
    }

    protected static String resolvePlaceholders(String value, Object o)
    {
        if (value==null) return null;

        StringBuilder newValue=new StringBuilder();

        int endPos=0;
        int startPos=0;
        for (;;)
        {
            startPos=value.indexOf("${", startPos);
            if (startPos<0) break;

            newValue.append(value.substring(endPos, startPos));

            endPos=value.indexOf("}", startPos)+1;
            if (endPos<=startPos) throw new IllegalArgumentException("Invalid placeholder in "+value);

            String placeholder=value.substring(startPos+2,endPos-1);

            String placeholderValue=getPropertyAsString(o, placeholder);

            if (placeholderValue==null) throw new IllegalArgumentException("Unresolved placeholder '"+placeholder+"' in "+value);

            newValue.append(placeholderValue);

            startPos=endPos;
        }
        newValue.append(value.substring(endPos));

        return newValue.toString();
    }

    public static class ConfPolicy
    {
        public String name;
        public String[] retain;
        public String timeZone;
        public Double reachFactor;
        public Boolean autoSync;
        public String referenceDate;
        public String snapshotDir;
        public String snapshotPattern;

        protected RetentionPolicy retentionPolicy;

        protected void applyDefaults(ConfPolicy defaults)
        {
            if (this.retain==null) this.retain=defaults.retain;
            if (this.timeZone==null) this.timeZone=defaults.timeZone;
            if (this.reachFactor==null) this.reachFactor=defaults.reachFactor;
            if (this.autoSync==null) this.autoSync=defaults.autoSync;
            if (this.referenceDate==null) this.referenceDate=defaults.referenceDate;
            if (this.snapshotDir==null) this.snapshotDir=defaults.snapshotDir;
            if (this.snapshotPattern==null) this.snapshotPattern=defaults.snapshotPattern;
        }

        protected void initialize()
        {
            if (retain==null || retain.length==0) throw new InvalidRuleException("Policy "+name+" has no retain rules");

            DateTimeZone zone;
            try
            {
                zone=DateTimeZone.forID(timeZone);
            }
            catch (IllegalArgumentException ex)
            {
                throw new IllegalArgumentException("Invalid timeZone for policy "+name+": "+timeZone, ex);
            }

            retentionPolicy=new RetentionPolicy(zone, retain)
                .setReachFactor(reachFactor.doubleValue())
                .setAutoSync(autoSync.booleanValue())
                .setReferenceDate(referenceDate);
            if (snapshotPattern!=null) retentionPolicy.setTimestampPatterns(snapshotPattern);
        }

        public RetentionPolicy getRetentionPolicy()
        {
            return retentionPolicy;
        }
    }

    public static class RetentionConfHolder
    {
        public ConfPolicy defaults;
        public ConfPolicy[] policies;
    }

}
