import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads BLAST hits line by line and groups consecutive lines of the same query.
 * The input has to be sorted by query already, as BLAST and BLAT write it; this is not
 * checked and a query split over several blocks comes out as several groups.
 * Grouped HSPs are ordered by descending score. The store can be iterated once.
 * Parse failures surface as {@link UncheckedIOException} wrapping a {@link BlastFormatException}.
 */
class StreamingHitStore implements HitStore, Closeable{

  private BufferedReader reader;
  private int lineNum;
  private boolean consumed;

  StreamingHitStore(BufferedReader reader){
    this.reader = reader;
  }

  static StreamingHitStore open(String path) throws IOException{
    return new StreamingHitStore(DataReader.openReader(path));
  }

  private HSP readNext(){
    try{
      for(String line = reader.readLine(); line != null; line = reader.readLine()){
        lineNum++;
        if(BlastParser.isComment(line)){
          continue;
        }
        try{
          return BlastParser.parseLine(line);
        }catch(BlastFormatException e){
          throw e.atLine(lineNum);
        }
      }
      return null;
    }catch(IOException e){
      throw new UncheckedIOException(e);
    }
  }

  private void markConsumed(){
    if(consumed){
      throw new IllegalStateException("Streaming hit store can be read only once");
    }
    consumed = true;
  }

  @Override
  public Iterator<HSP> iterHSPs(){
    markConsumed();
    return new Iterator<HSP>(){

      private HSP next = readNext();

      @Override
      public boolean hasNext(){
        return next != null;
      }

      @Override
      public HSP next(){
        if(next == null){
          throw new NoSuchElementException();
        }
        HSP res = next;
        next = readNext();
        return res;
      }
    };
  }

  @Override
  public Iterator<BlastHit> iterHits(){
    markConsumed();
    return new Iterator<BlastHit>(){

      private HSP pending = readNext();

      @Override
      public boolean hasNext(){
        return pending != null;
      }

      @Override
      public BlastHit next(){
        if(pending == null){
          throw new NoSuchElementException();
        }
        BlastHit hit = new BlastHit(pending.query);
        while(pending != null && pending.query.equals(hit.queryID)){
          hit.hsps.add(pending);
          pending = readNext();
        }
        hit.sortByScore();
        return hit;
      }
    };
  }

  @Override
  public void close() throws IOException{
    reader.close();
  }

}
