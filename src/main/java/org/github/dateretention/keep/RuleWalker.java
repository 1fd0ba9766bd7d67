package org.github.dateretention.keep;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks one rule backward from the reference instant and marks the best candidate of each window.
 *
 * The candidate list must be sorted by instant (oldest first). Windows and candidates are both iterated
 * backward: the epoch variables track the current window, the cursor tracks the most recent candidate
 * that may still be claimed.
 */
class RuleWalker
{
    protected static final Logger LOG=LoggerFactory.getLogger(RuleWalker.class);

    protected final List<Candidate> candidates;
    protected final RetentionSettings settings;

    RuleWalker(List<Candidate> candidates, RetentionSettings settings)
    {
        this.candidates=candidates;
        this.settings=settings;
    }

    /**
     * Drift halving and its 7/8 decay use integer division, which truncates toward zero rather than flooring.
     *
     * @return the number of windows for which a keeper was found
     */
    int mark(RetentionRule rule, long reference)
    {
        double reachFactor=rule.getReachFactor(settings.getDefaultReachFactor());
        boolean autoSync=settings.isAutoSync();
        String ruleName=rule.toString();

        long epoch=reference;
        long finalEpoch=rule.spanStart(reference);
        long drift=0;
        int cursor=candidates.size()-1;
        int matched=0;

        while (epoch>finalEpoch && cursor>=0)
        {
            long nextEpoch=rule.stepBack(epoch);
            if (nextEpoch>=epoch) throw new InvalidRuleException("Rule does not step backward from "+epoch+": "+ruleName);

            double radius=(epoch-nextEpoch)/2.0*reachFactor;
            long goal=Math.floorDiv(epoch+nextEpoch, 2L)+drift;

            // nothing newer than this window's reach can be claimed by this or any older window
            while (cursor>=0 && candidates.get(cursor).instant>goal+radius) cursor--;

            Candidate best=null;
            int bestIndex=-1;
            for (int i=cursor;i>=0;i--)
            {
                Candidate candidate=candidates.get(i);
                if (candidate.instant<goal-radius) break;

                // strict comparison: on equal distance the more recent candidate wins
                if (best==null || Math.abs(candidate.instant-goal)<Math.abs(best.instant-goal))
                {
                    best=candidate;
                    bestIndex=i;
                }
            }

            if (best!=null)
            {
                LOG.trace("  window ({}..{}] goal {}: keeping {}",nextEpoch,epoch,goal,best);
                best.markKept(ruleName);
                matched++;
                cursor=Math.min(cursor, bestIndex-1);

                if (autoSync) drift+=(best.instant-goal)/2;
            }
            else
            {
                LOG.trace("  window ({}..{}] goal {}: no candidate within {}s",nextEpoch,epoch,goal,radius);
            }

            epoch=nextEpoch;
            if (drift!=0) drift=drift*7/8;
        }

        return matched;
    }
}
