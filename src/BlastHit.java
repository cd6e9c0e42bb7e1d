import java.util.ArrayList;
import java.util.HashSet;

/**
 * All HSPs reported for one query.
 */
public class BlastHit{

  public String queryID;
  public ArrayList<HSP> hsps;

  public BlastHit(String queryID){
    this.queryID = queryID;
    hsps = new ArrayList<>();
  }

  void sortByScore(){
    hsps.sort(HSPChainer.BY_SCORE_DESC);
  }

  /**
   * Up to n best scoring HSPs; with allHSPs every HSP against the subjects of those.
   */
  ArrayList<HSP> getBest(int n, boolean allHSPs){
    ArrayList<HSP> sorted = new ArrayList<>(hsps);
    sorted.sort(HSPChainer.BY_SCORE_DESC);
    ArrayList<HSP> best = new ArrayList<>(sorted.subList(0, Math.min(n, sorted.size())));
    if(!allHSPs){
      return best;
    }
    HashSet<String> selected = new HashSet<>();
    for(HSP hsp: best){
      selected.add(hsp.subject);
    }
    ArrayList<HSP> res = new ArrayList<>();
    for(HSP hsp: sorted){
      if(selected.contains(hsp.subject)){
        res.add(hsp);
      }
    }
    return res;
  }

}
