package org.github.dateretention.keep;

/**
 * One timestamp under consideration during a single prune call.
 */
class Candidate implements Comparable<Candidate>
{
    final long instant;
    final int originalIndex;
    boolean keep;
    String keptBy;
    
    Candidate(long instant, int originalIndex)
    {
        this.instant=instant;
        this.originalIndex=originalIndex;
    }
    
    void markKept(String reason)
    {
        keep=true;
        keptBy=(keptBy==null)?reason:keptBy+" | "+reason;
    }
    
    @Override
    public int compareTo(Candidate o)
    {
        if (instant!=o.instant) return instant<o.instant?-1:1;
        return Integer.compare(originalIndex, o.originalIndex);
    }
    
    @Override
    public String toString()
    {
        return "#"+originalIndex+"@"+instant;
    }
}
