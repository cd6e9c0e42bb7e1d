import gnu.trove.map.hash.TObjectIntHashMap;

import java.io.IOException;
import java.util.NoSuchElementException;

/**
 * Sequence lengths by id.
 */
class SequenceSizes{

  private TObjectIntHashMap<String> sizes;

  SequenceSizes(TObjectIntHashMap<String> sizes){
    this.sizes = sizes;
  }

  static SequenceSizes load(String fastaPath) throws IOException{
    return new SequenceSizes(FastaReader.readSizes(fastaPath));
  }

  int getSize(String seqID){
    if(!sizes.containsKey(seqID)){
      throw new NoSuchElementException("Unknown sequence: " + seqID);
    }
    return sizes.get(seqID);
  }

  int size(){
    return sizes.size();
  }

}
