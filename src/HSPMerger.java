/**
 * Folds a cluster of chained HSPs into one hit spanning all of them.
 */
class HSPMerger extends Constants{

  static HSP merge(Cluster cluster){
    if(cluster.size() == 0){
      throw new IllegalArgumentException("Can not merge an empty cluster");
    }
    HSP first = cluster.get(0);
    if(cluster.size() == 1){
      return first;
    }
    int alnLen = 0;
    int mismatches = 0;
    int gaps = 0;
    double score = 0;
    int startQ = first.startQ;
    int endQ = first.endQ;
    int startS = first.startS;
    int endS = first.endS;
    for(HSP hsp: cluster.hsps){
      if(!hsp.query.equals(first.query) || !hsp.subject.equals(first.subject) ||
          hsp.reversed != first.reversed){
        throw new IllegalStateException("Cluster mixes hits: " + first + " and " + hsp);
      }
      alnLen += hsp.alnLen;
      mismatches += hsp.mismatches;
      gaps += hsp.gaps;
      score += hsp.score;
      startQ = Math.min(startQ, hsp.startQ);
      endQ = Math.max(endQ, hsp.endQ);
      startS = Math.min(startS, hsp.startS);
      endS = Math.max(endS, hsp.endS);
    }
    // zero alignment length gives NaN or infinity, left as is
    double identity = 100 - (mismatches + gaps) * 100.0 / alnLen;
    int sStart = first.reversed ? endS : startS;
    int sEnd = first.reversed ? startS : endS;
    return new HSP(first.query, first.subject, identity, alnLen, mismatches, gaps, startQ, endQ,
        sStart, sEnd, first.eValue, score,
        formatIdentity(identity), first.eValueText(), formatNumber(score));
  }

}
