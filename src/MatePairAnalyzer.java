import gnu.trove.list.array.TIntArrayList;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reports how many paired ends mapped and the distance between mates.
 * Mates share the read name once the last rClip characters are removed, e.g. /1 and /2
 * or .f and .r. Pairs farther apart than the cutoff are not linked; without a fixed cutoff
 * it is estimated once as twice the median distance, rounded up to a multiple of the bin size.
 */
class MatePairAnalyzer extends Constants{

  private int cutoff;
  private String mateOrientation;
  private int rClip;
  private int bins;
  private DistanceMode distMode;
  private Logger logger;

  MatePairAnalyzer(int cutoff, String mateOrientation, int rClip, int bins, DistanceMode distMode,
                   Logger logger){
    if(mateOrientation != null && !isMateOrientation(mateOrientation)){
      throw new IllegalArgumentException("Unknown mate orientation '" + mateOrientation +
          "', expected one of ++, --, +-, -+");
    }
    if(rClip < 0){
      throw new IllegalArgumentException("Number of clipped characters can not be negative: " + rClip);
    }
    if(bins <= 0){
      throw new IllegalArgumentException("Bin size should be positive: " + bins);
    }
    this.cutoff = cutoff;
    this.mateOrientation = mateOrientation;
    this.rClip = rClip;
    this.bins = bins;
    this.distMode = distMode;
    this.logger = logger;
  }

  private static Element pairsElement(Document document){
    return document.getRootElement().getChild("Pairs");
  }

  private class PairNameComparator implements Comparator<Location>{

    @Override
    public int compare(Location a, Location b){
      return pairName(a.name).compareTo(pairName(b.name));
    }

  }

  String pairName(String readName){
    if(rClip == 0){
      return readName;
    }
    return readName.substring(0, Math.max(0, readName.length() - rClip));
  }

  static int estimateCutoff(TIntArrayList distances, int bins){
    TIntArrayList sorted = new TIntArrayList(distances);
    sorted.sort();
    double median = MatePairStats.median(sorted);
    return (int) Math.ceil(2 * median / bins) * bins;
  }

  MatePairStats analyze(List<Location> reads){
    MatePairStats stats = new MatePairStats();
    ArrayList<Location> sorted = new ArrayList<>(reads);
    sorted.sort(new PairNameComparator());
    ArrayList<PairedRead> allPairs = new ArrayList<>();
    int from = 0;
    while(from < sorted.size()){
      String name = pairName(sorted.get(from).name);
      int to = from + 1;
      while(to < sorted.size() && pairName(sorted.get(to).name).equals(name)){
        to++;
      }
      if(to - from != 2){
        stats.fragmentNum += to - from;
      }else{
        stats.pairNum++;
        PairedRead pair = new PairedRead(name, sorted.get(from), sorted.get(from + 1), distMode);
        if(pair.distance >= 0){
          allPairs.add(pair);
        }
      }
      from = to;
    }
    if(mateOrientation != null){
      ArrayList<PairedRead> selected = new ArrayList<>();
      for(PairedRead pair: allPairs){
        if(pair.orientation.equals(mateOrientation)){
          selected.add(pair);
        }
      }
      allPairs = selected;
    }
    stats.cutoff = cutoff;
    if(cutoff <= 0){
      if(allPairs.isEmpty()){
        stats.cutoff = 0;
        logger.println("No mate pairs to estimate insert size cutoff from");
      }else{
        TIntArrayList distances = new TIntArrayList(allPairs.size());
        for(PairedRead pair: allPairs){
          distances.add(pair.distance);
        }
        stats.cutoff = estimateCutoff(distances, bins);
        logger.printf("Insert size cutoff set to %d, use '-cutoff' to override\n", stats.cutoff);
      }
    }
    for(PairedRead pair: allPairs){
      if(pair.distance > stats.cutoff){
        continue;
      }
      stats.linkedPairs.add(pair);
      stats.linkedDistances.add(pair.distance);
      Integer count = stats.orientations.get(pair.orientation);
      stats.orientations.put(pair.orientation, count == null ? 1 : count + 1);
    }
    stats.linkedDistances.sort();
    stats.computeStats();
    return stats;
  }

  void printReport(MatePairStats stats){
    logger.printf("%d fragments, %d pairs\n", stats.fragmentNum, stats.pairNum);
    int linkNum = stats.getLinkNum();
    logger.printf("%d pairs (%.1f%%) are linked (cutoff=%d)\n", linkNum,
        linkNum * 100.0 / stats.pairNum, stats.cutoff);
    if(linkNum == 0){
      return;
    }
    logger.printf("mean distance between mates: %d +/- %d\n", (int) stats.mean, (int) stats.stdev);
    logger.printf("median distance between mates: %d\n", (int) stats.median);
    logger.printf("95%% distance range: %d - %d\n", stats.p025, stats.p975);
    logger.println("\nOrientations:");
    for(Map.Entry<String, Integer> entry: stats.orientations.entrySet()){
      logger.printf("%s:%d (%.1f%%)\n", entry.getKey(), entry.getValue(),
          stats.getOrientationPercent(entry.getKey()));
    }
  }

  static void writePairs(MatePairStats stats, String path) throws IOException{
    try(BufferedWriter writer = DataReader.openWriter(path)){
      for(PairedRead pair: stats.linkedPairs){
        writer.write(pair.toPairLine());
        writer.newLine();
      }
    }
  }

  static void writeInserts(MatePairStats stats, String path) throws IOException{
    try(BufferedWriter writer = DataReader.openWriter(path)){
      for(int i = 0; i < stats.linkedDistances.size(); i++){
        writer.write(Integer.toString(stats.linkedDistances.get(i)));
        writer.newLine();
      }
    }
  }

  static void addParameters(ArgumentParser parser){
    parser.description("Reports how many paired ends mapped, average distance between paired ends, etc. " +
        "Paired reads must have the same prefix, use -rclip to remove the trailing part, e.g. /1, /2, " +
        "or .f, .r; default behavior is to truncate the last char.");
    parser.addArgument("infile").help("tabular BLAST file, BED file (.bed) or SAM/BAM file (.sam, .bam)");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
    parser.addArgument("-cutoff").dest("cutoff").help("distance to call valid links between mates, " +
        "default: estimate from input");
    parser.addArgument("-mateorientation").dest("mate_orientation").choices(MATE_ORIENTATIONS)
        .help("use only certain mate orientations");
    parser.addArgument("-pairsfile").dest("pairs_file").help("write valid pairs to this file");
    parser.addArgument("-insertsfile").dest("inserts_file").help("write linked distances to this file, " +
        "one per line");
    parser.addArgument("-nrows").dest("nrows").help("only use the first n features, 0 for all, default 100000");
    parser.addArgument("-rclip").dest("rclip").help("pair ID is derived from read name by removing " +
        "this many trailing chars, default 1");
    parser.addArgument("-bins").dest("bins").help("bin size used to round the estimated cutoff, default 20");
    parser.addArgument("-distmode").dest("dist_mode").choices("ss", "ee").help("distance mode between " +
        "paired reads, ss is outer distance, ee is inner distance, default ss");
    parser.addArgument("-sam").dest("sam").action(Arguments.storeTrue()).help("read input as SAM/BAM " +
        "whatever its extension");
  }

  static void run(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    Element element = pairsElement(config);
    int cutoff = Integer.parseInt(element.getChildText("Cutoff"));
    int rClip = Integer.parseInt(element.getChildText("RClip"));
    int bins = Integer.parseInt(element.getChildText("Bins"));
    int nRows = Integer.parseInt(element.getChildText("NRows"));
    String distMode = element.getChildText("DistMode");
    if(parsedArgs.getString("cutoff") != null){
      cutoff = Integer.parseInt(parsedArgs.getString("cutoff"));
    }
    if(parsedArgs.getString("rclip") != null){
      rClip = Integer.parseInt(parsedArgs.getString("rclip"));
    }
    if(parsedArgs.getString("bins") != null){
      bins = Integer.parseInt(parsedArgs.getString("bins"));
    }
    if(parsedArgs.getString("nrows") != null){
      nRows = Integer.parseInt(parsedArgs.getString("nrows"));
    }
    if(parsedArgs.getString("dist_mode") != null){
      distMode = parsedArgs.getString("dist_mode");
    }
    Logger logger = Logger.getInstance(config);
    MatePairAnalyzer analyzer = new MatePairAnalyzer(cutoff, parsedArgs.getString("mate_orientation"),
        rClip, bins, DistanceMode.fromCode(distMode), logger);
    String inPath = parsedArgs.getString("infile");
    ArrayList<Location> reads;
    if(parsedArgs.getBoolean("sam") || DataReader.isSam(inPath)){
      reads = DataReader.readSam(inPath, nRows);
    }else if(DataReader.isBed(inPath)){
      reads = DataReader.readBed(inPath, nRows);
    }else{
      reads = DataReader.readProjections(inPath, nRows);
    }
    MatePairStats stats = analyzer.analyze(reads);
    analyzer.printReport(stats);
    if(parsedArgs.getString("pairs_file") != null){
      writePairs(stats, parsedArgs.getString("pairs_file"));
    }
    if(parsedArgs.getString("inserts_file") != null){
      writeInserts(stats, parsedArgs.getString("inserts_file"));
      logger.println("Linked distances written to " + parsedArgs.getString("inserts_file"));
    }
  }

}
