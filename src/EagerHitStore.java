import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps the whole BLAST file in memory, sorted by query unless told it already is.
 */
class EagerHitStore implements HitStore{

  private static class QueryComparator implements Comparator<HSP>{

    @Override
    public int compare(HSP a, HSP b){
      return a.query.compareTo(b.query);
    }

  }

  private static final Comparator<HSP> BY_QUERY = new QueryComparator();

  private ArrayList<HSP> hsps;

  EagerHitStore(List<HSP> hsps, boolean sorted){
    this.hsps = new ArrayList<>(hsps);
    if(!sorted){
      this.hsps.sort(BY_QUERY);
    }
  }

  EagerHitStore(List<HSP> hsps){
    this(hsps, false);
  }

  static EagerHitStore load(String path) throws IOException{
    try(BufferedReader reader = DataReader.openReader(path)){
      return new EagerHitStore(BlastParser.parseBlast(reader));
    }
  }

  ArrayList<HSP> getHSPs(){
    return hsps;
  }

  int size(){
    return hsps.size();
  }

  @Override
  public Iterator<HSP> iterHSPs(){
    return hsps.iterator();
  }

  @Override
  public Iterator<BlastHit> iterHits(){
    ArrayList<BlastHit> hits = new ArrayList<>();
    BlastHit hit = null;
    for(HSP hsp: hsps){
      if(hit == null || !hit.queryID.equals(hsp.query)){
        hit = new BlastHit(hsp.query);
        hits.add(hit);
      }
      hit.hsps.add(hsp);
    }
    return hits.iterator();
  }

}
