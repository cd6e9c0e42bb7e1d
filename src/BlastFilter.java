import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;

/**
 * Keeps BLAST lines passing score, identity, alignment length and e-value cutoffs.
 */
class BlastFilter extends Constants{

  private double minScore;
  private double minIdentity;
  private int minHitLen;
  private double maxEValue;

  BlastFilter(double minScore, double minIdentity, int minHitLen, double maxEValue){
    this.minScore = minScore;
    this.minIdentity = minIdentity;
    this.minHitLen = minHitLen;
    this.maxEValue = maxEValue;
  }

  BlastFilter(Document document){
    Element element = document.getRootElement().getChild("Filter");
    minScore = Double.parseDouble(element.getChildText("Score"));
    minIdentity = Double.parseDouble(element.getChildText("PctID"));
    minHitLen = Integer.parseInt(element.getChildText("HitLen"));
    maxEValue = Double.parseDouble(element.getChildText("EValue"));
  }

  boolean accept(HSP hsp){
    return hsp.score >= minScore && hsp.identity >= minIdentity && hsp.alnLen >= minHitLen &&
        hsp.eValue <= maxEValue;
  }

  /**
   * Copies accepted lines unchanged, drops comments.
   * @return number of lines kept
   */
  int filter(BufferedReader reader, BufferedWriter writer) throws IOException{
    int kept = 0;
    int lineNum = 0;
    for(String line = reader.readLine(); line != null; line = reader.readLine()){
      lineNum++;
      if(BlastParser.isComment(line)){
        continue;
      }
      HSP hsp;
      try{
        hsp = BlastParser.parseLine(line);
      }catch(BlastFormatException e){
        throw e.atLine(lineNum);
      }
      if(accept(hsp)){
        writer.write(line);
        writer.newLine();
        kept++;
      }
    }
    return kept;
  }

  String getDefaultOutPath(String blastPath){
    return blastPath + ".P" + formatNumber(minIdentity) + "L" + minHitLen;
  }

  static void addParameters(ArgumentParser parser){
    parser.description("Produces a new BLAST file filtered on score, percent identity, hit length and " +
        "e-value. Cutoffs not given on the command line are taken from the config.");
    parser.addArgument("blastfile").help("tabular BLAST file");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
    parser.addArgument("-score").dest("score").help("score cutoff, default 0");
    parser.addArgument("-pctid").dest("pctid").help("percent identity cutoff, default 95");
    parser.addArgument("-hitlen").dest("hitlen").help("hit length cutoff, default 100");
    parser.addArgument("-evalue").dest("evalue").help("e-value cutoff, default 0.01");
    parser.addArgument("-o").dest("output").help("output file, default <blastfile>.P<pctid>L<hitlen>");
  }

  static void run(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    Element element = config.getRootElement().getChild("Filter");
    double score = Double.parseDouble(valueOf(parsedArgs, "score", element.getChildText("Score")));
    double pctid = Double.parseDouble(valueOf(parsedArgs, "pctid", element.getChildText("PctID")));
    int hitLen = Integer.parseInt(valueOf(parsedArgs, "hitlen", element.getChildText("HitLen")));
    double eValue = Double.parseDouble(valueOf(parsedArgs, "evalue", element.getChildText("EValue")));
    BlastFilter filter = new BlastFilter(score, pctid, hitLen, eValue);
    String blastPath = parsedArgs.getString("blastfile");
    String outPath = parsedArgs.getString("output");
    if(outPath == null){
      outPath = filter.getDefaultOutPath(blastPath);
    }
    int kept;
    try(BufferedReader reader = DataReader.openReader(blastPath);
        BufferedWriter writer = DataReader.openWriter(outPath)){
      kept = filter.filter(reader, writer);
    }
    Logger.getInstance(config).printf("%d lines written to %s\n", kept, outPath);
  }

  private static String valueOf(Namespace parsedArgs, String dest, String configValue){
    String value = parsedArgs.getString(dest);
    return value == null ? configValue : value;
  }

}
