import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.Iterator;

/**
 * Best score of every sequence over all hits it takes part in, as query or as subject.
 * Built once and only read afterwards.
 */
class BestScoreIndex{

  private final TObjectDoubleHashMap<String> bestScores;

  private BestScoreIndex(TObjectDoubleHashMap<String> bestScores){
    this.bestScores = bestScores;
  }

  static BestScoreIndex build(Iterator<HSP> hsps){
    // unknown sequences score 0
    TObjectDoubleHashMap<String> bestScores = new TObjectDoubleHashMap<>(1000, 0.5f, 0);
    while(hsps.hasNext()){
      HSP hsp = hsps.next();
      if(hsp.score > bestScores.get(hsp.query)){
        bestScores.put(hsp.query, hsp.score);
      }
      if(hsp.score > bestScores.get(hsp.subject)){
        bestScores.put(hsp.subject, hsp.score);
      }
    }
    return new BestScoreIndex(bestScores);
  }

  double getBestScore(String seqID){
    return bestScores.get(seqID);
  }

  int size(){
    return bestScores.size();
  }

}
