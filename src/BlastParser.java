import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;

/**
 * Parses tabular BLAST output (-m8, -outfmt 6).
 */
class BlastParser extends Constants{

  static HSP parseLine(String line) throws BlastFormatException{
    String[] fields = line.split("\t", -1);
    if(fields.length < BLAST_COLUMNS){
      throw new BlastFormatException("Expected " + BLAST_COLUMNS + " tab separated fields, found " +
          fields.length + ": '" + line + "'");
    }
    try{
      String identityText = fields[2].trim();
      String eValueText = fields[10].trim();
      String scoreText = fields[11].trim();
      return new HSP(fields[0], fields[1],
          Double.parseDouble(identityText),
          Integer.parseInt(fields[3].trim()),
          Integer.parseInt(fields[4].trim()),
          Integer.parseInt(fields[5].trim()),
          Integer.parseInt(fields[6].trim()),
          Integer.parseInt(fields[7].trim()),
          Integer.parseInt(fields[8].trim()),
          Integer.parseInt(fields[9].trim()),
          Double.parseDouble(eValueText),
          Double.parseDouble(scoreText),
          identityText, eValueText, scoreText);
    }catch(NumberFormatException e){
      throw new BlastFormatException("Non numeric value in '" + line + "'", e);
    }
  }

  static boolean isComment(String line){
    return line.startsWith(COMMENT_PREFIX) || line.trim().isEmpty();
  }

  /**
   * Reads every hit, skipping comment and blank lines.
   */
  static ArrayList<HSP> parseBlast(BufferedReader reader) throws IOException{
    ArrayList<HSP> res = new ArrayList<>();
    int lineNum = 0;
    for(String line = reader.readLine(); line != null; line = reader.readLine()){
      lineNum++;
      if(isComment(line)){
        continue;
      }
      try{
        res.add(parseLine(line));
      }catch(BlastFormatException e){
        throw e.atLine(lineNum);
      }
    }
    return res;
  }

}
