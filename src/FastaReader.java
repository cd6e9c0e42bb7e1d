import gnu.trove.map.hash.TObjectIntHashMap;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Reads sequence lengths from a FASTA file. Sequences are named by the first word of the header.
 */
public class FastaReader{

  protected static TObjectIntHashMap<String> readSizes(BufferedReader reader) throws IOException{
    TObjectIntHashMap<String> res = new TObjectIntHashMap<>();
    String name = null;
    int length = 0;
    for(String line = reader.readLine(); line != null; line = reader.readLine()){
      if(line.startsWith(">")){
        if(name != null){
          res.put(name, length);
        }
        String[] words = line.substring(1).trim().split("\\s+", 2);
        name = words[0];
        length = 0;
      }else{
        length += line.trim().length();
      }
    }
    if(name != null){
      res.put(name, length);
    }
    return res;
  }

  protected static TObjectIntHashMap<String> readSizes(String path) throws IOException{
    try(BufferedReader reader = DataReader.openReader(path)){
      return readSizes(reader);
    }
  }

}
