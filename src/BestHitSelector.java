import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.JDOMException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;

/**
 * Best BLAST hits of every query.
 */
class BestHitSelector extends Constants{

  private int n;
  private boolean allHSPs;

  BestHitSelector(int n, boolean allHSPs){
    if(n <= 0){
      throw new IllegalArgumentException("Number of best hits should be positive: " + n);
    }
    this.n = n;
    this.allHSPs = allHSPs;
  }

  ArrayList<HSP> selectBest(HitStore store){
    ArrayList<HSP> res = new ArrayList<>();
    for(Iterator<BlastHit> iter = store.iterHits(); iter.hasNext();){
      res.addAll(iter.next().getBest(n, allHSPs));
    }
    return res;
  }

  static void addParameters(ArgumentParser parser){
    parser.description("Prints the best hit for each query in the BLAST file.");
    parser.addArgument("blastfile").help("tabular BLAST file");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
    parser.addArgument("-n").dest("n").setDefault("1").help("get best N hits, default 1");
    parser.addArgument("-hsps").dest("hsps").action(Arguments.storeTrue())
        .help("get all HSPs for the best pairs");
    parser.addArgument("-sorted").dest("sorted").action(Arguments.storeTrue())
        .help("input is already grouped by query: stream it instead of loading it into memory");
    parser.addArgument("-o").dest("output").help("output file, default standard output");
  }

  static void run(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    BestHitSelector selector = new BestHitSelector(Integer.parseInt(parsedArgs.getString("n")),
        parsedArgs.getBoolean("hsps"));
    String blastPath = parsedArgs.getString("blastfile");
    ArrayList<HSP> best;
    if(parsedArgs.getBoolean("sorted")){
      try(StreamingHitStore store = StreamingHitStore.open(blastPath)){
        best = selector.selectBest(store);
      }
    }else{
      best = selector.selectBest(EagerHitStore.load(blastPath));
    }
    Logger.getInstance(config).printf("%d best hits selected\n", best.size());
    try(BufferedWriter writer = DataReader.openWriter(parsedArgs.getString("output"))){
      for(HSP hsp: best){
        writer.write(hsp.toString());
        writer.newLine();
      }
    }
  }

}
