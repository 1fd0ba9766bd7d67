package org.github.dateretention.keep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a list of timestamps into keepers and prunables according to a set of retention rules.
 *
 * Each rule is walked independently over the same candidates. A candidate kept by any rule is kept, so
 * adding a rule never prunes more. The engine holds no state between calls and does no I/O.
 */
public class RetentionEngine
{
    protected static final Logger LOG=LoggerFactory.getLogger(RetentionEngine.class);

    /**
     * Candidates that already are seconds since epoch.
     */
    public static final IInstantCoercer<Number> EPOCH_SECONDS=new IInstantCoercer<Number>()
    {
        @Override
        public long toEpochSeconds(Number value) throws InvalidTimestampException
        {
            if (value==null) throw new InvalidTimestampException(value, "Timestamp must not be null");
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) return value.longValue();
            double seconds=value.doubleValue();
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) throw new InvalidTimestampException(value, "Not a valid timestamp: "+value);
            return (long) Math.floor(seconds);
        }
    };

    protected final List<RetentionRule> rules;
    protected final RetentionSettings settings;

    public RetentionEngine(List<? extends RetentionRule> rules)
    {
        this(rules, RetentionSettings.DEFAULTS);
    }

    public RetentionEngine(List<? extends RetentionRule> rules, RetentionSettings settings)
    {
        if (rules==null) throw new InvalidRuleException("rules must not be null");
        if (settings==null) throw new IllegalArgumentException("settings must not be null");
        for (RetentionRule rule: rules)
        {
            if (rule==null) throw new InvalidRuleException("rules must not contain null: "+rules);
        }
        this.rules=Collections.unmodifiableList(new ArrayList<RetentionRule>(rules));
        this.settings=settings;
    }

    public static <T> List<T> partition(List<T> candidates, IInstantCoercer<? super T> coercer,
            List<? extends RetentionRule> rules, long reference, double defaultReachFactor, boolean autoSync)
    {
        return new RetentionEngine(rules, new RetentionSettings(defaultReachFactor, autoSync)).partition(candidates, coercer, reference);
    }

    public <T extends Number> List<T> partition(List<T> candidates, long reference)
    {
        return partition(candidates, EPOCH_SECONDS, reference);
    }

    /**
     * Removes every element that no rule wants to keep from <code>candidates</code>. The remaining elements
     * keep their relative order.
     *
     * @param candidates a modifiable list; on return it contains only the kept elements
     * @param reference the instant (seconds since epoch) all rules walk back from
     * @return the pruned elements, in their original relative order
     * @throws InvalidRuleException if a rule is unusable for this reference; the list is left untouched
     * @throws InvalidTimestampException if an element cannot be coerced; the list is left untouched
     */
    public <T> List<T> partition(List<T> candidates, IInstantCoercer<? super T> coercer, long reference)
    {
        for (RetentionRule rule: rules)
        {
            rule.validate(reference);
        }

        List<Candidate> sorted=sortCandidates(candidates, coercer);

        RuleWalker walker=new RuleWalker(sorted, settings);
        for (RetentionRule rule: rules)
        {
            int matched=walker.mark(rule, reference);
            LOG.debug("Rule {} matched {} windows",rule,matched);
        }

        return merge(candidates, sorted);
    }

    protected <T> List<Candidate> sortCandidates(List<T> candidates, IInstantCoercer<? super T> coercer)
    {
        List<Candidate> sorted=new ArrayList<>(candidates.size());
        int index=0;
        for (T candidate: candidates)
        {
            sorted.add(new Candidate(coercer.toEpochSeconds(candidate), index++));
        }
        // ties are ordered by original position
        Collections.sort(sorted);
        return sorted;
    }

    protected <T> List<T> merge(List<T> candidates, List<Candidate> sorted)
    {
        boolean[] keep=new boolean[sorted.size()];
        String[] keptBy=new String[sorted.size()];
        for (Candidate candidate: sorted)
        {
            keep[candidate.originalIndex]=candidate.keep;
            keptBy[candidate.originalIndex]=candidate.keptBy;
        }

        List<T> retain=new ArrayList<>();
        List<T> prune=new ArrayList<>();
        int index=0;
        for (T candidate: candidates)
        {
            if (keep[index])
            {
                retain.add(candidate);
                if (LOG.isDebugEnabled()) LOG.debug("{}: {}",candidate,keptBy[index]);
            }
            else
            {
                prune.add(candidate);
                if (LOG.isDebugEnabled()) LOG.debug("{}: PRUNE",candidate);
            }
            index++;
        }

        candidates.clear();
        candidates.addAll(retain);

        return prune;
    }
}
