import gnu.trove.iterator.TIntIterator;
import gnu.trove.list.array.TIntArrayList;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Chains adjacent HSPs of the same query, subject and orientation into larger HSPs.
 * Two HSPs are linked when they lie within xDist of each other on the query and within
 * yDist on the subject; chains are the connected components of these links.
 */
class HSPChainer extends Constants{

  private static class QuerySubjectComparator implements Comparator<HSP>{

    @Override
    public int compare(HSP a, HSP b){
      int res = a.query.compareTo(b.query);
      return res != 0 ? res : a.subject.compareTo(b.subject);
    }

  }

  private static class CoordComparator implements Comparator<HSP>{

    @Override
    public int compare(HSP a, HSP b){
      if(a.startQ != b.startQ){
        return Integer.compare(a.startQ, b.startQ);
      }
      if(a.endQ != b.endQ){
        return Integer.compare(a.endQ, b.endQ);
      }
      if(a.startS != b.startS){
        return Integer.compare(a.startS, b.startS);
      }
      return Integer.compare(a.endS, b.endS);
    }

  }

  private static class ScoreDescComparator implements Comparator<HSP>{

    @Override
    public int compare(HSP a, HSP b){
      return Double.compare(b.score, a.score);
    }

  }

  private static final Comparator<HSP> BY_QUERY_SUBJECT = new QuerySubjectComparator();
  private static final Comparator<HSP> BY_COORDINATES = new CoordComparator();
  static final Comparator<HSP> BY_SCORE_DESC = new ScoreDescComparator();

  private int xDist;
  private int yDist;

  HSPChainer(int xDist, int yDist){
    if(xDist <= 0 || yDist <= 0){
      throw new IllegalArgumentException("Chaining distances should be positive, got " + xDist + " and " + yDist);
    }
    this.xDist = xDist;
    this.yDist = yDist;
  }

  HSPChainer(Document document){
    this(readDistance(document), readDistance(document));
  }

  private static int readDistance(Document document){
    Element element = document.getRootElement().getChild("Chain");
    return Integer.parseInt(element.getChildText("Distance"));
  }

  static int queryDistance(HSP a, HSP b){
    // both on a dummy common sequence
    Interval aRange = new Interval("0", a.startQ, a.endQ, a.orientation());
    Interval bRange = new Interval("0", b.startQ, b.endQ, b.orientation());
    return Math.abs(Interval.distance(aRange, bRange, DistanceMode.EDGE));
  }

  static int subjectDistance(HSP a, HSP b){
    Interval aRange = new Interval("0", a.startS, a.endS, a.orientation());
    Interval bRange = new Interval("0", b.startS, b.endS, b.orientation());
    return Math.abs(Interval.distance(aRange, bRange, DistanceMode.EDGE));
  }

  /**
   * Clusters of one query and subject pair, ordered by their first member.
   */
  ArrayList<Cluster> cluster(List<HSP> partition){
    ArrayList<HSP> points = new ArrayList<>(partition);
    points.sort(BY_COORDINATES);
    int n = points.size();
    DisjointSet clusters = new DisjointSet(n);
    for(int i = 0; i < n; i++){
      clusters.add();
    }
    for(int i = 0; i < n; i++){
      HSP a = points.get(i);
      for(int j = i + 1; j < n; j++){
        HSP b = points.get(j);
        if(a.reversed != b.reversed){
          continue;
        }
        if(queryDistance(a, b) > xDist){
          continue;
        }
        if(subjectDistance(a, b) > yDist){
          continue;
        }
        clusters.union(i, j);
      }
    }
    ArrayList<Cluster> res = new ArrayList<>();
    for(TIntArrayList component: clusters.components()){
      Cluster cluster = new Cluster();
      for(TIntIterator iter = component.iterator(); iter.hasNext();){
        cluster.addHSP(points.get(iter.next()));
      }
      res.add(cluster);
    }
    return res;
  }

  ArrayList<HSP> chain(List<HSP> hsps){
    ArrayList<HSP> sorted = new ArrayList<>(hsps);
    sorted.sort(BY_QUERY_SUBJECT);
    ArrayList<HSP> res = new ArrayList<>();
    int from = 0;
    while(from < sorted.size()){
      int to = from + 1;
      while(to < sorted.size() && BY_QUERY_SUBJECT.compare(sorted.get(from), sorted.get(to)) == 0){
        to++;
      }
      for(Cluster cluster: cluster(sorted.subList(from, to))){
        res.add(HSPMerger.merge(cluster));
      }
      from = to;
    }
    Collections.sort(res, BY_SCORE_DESC);
    return res;
  }

  static void addParameters(ArgumentParser parser){
    parser.description("Chains adjacent HSPs together to form larger HSPs. The adjacent HSPs have to " +
        "share the same orientation.");
    parser.addArgument("blastfile").help("tabular BLAST file");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
    parser.addArgument("-dist").dest("dist").help("extent of flanking regions to search, " +
        "overrides Chain/Distance from config, default 100");
    parser.addArgument("-o").dest("output").help("output file, default standard output");
  }

  static void run(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    String dist = parsedArgs.getString("dist");
    HSPChainer chainer;
    if(dist == null){
      chainer = new HSPChainer(config);
    }else{
      chainer = new HSPChainer(Integer.parseInt(dist), Integer.parseInt(dist));
    }
    Logger logger = Logger.getInstance(config);
    EagerHitStore store = EagerHitStore.load(parsedArgs.getString("blastfile"));
    ArrayList<HSP> chained = chainer.chain(store.getHSPs());
    logger.printf("Chained %d HSPs into %d\n", store.size(), chained.size());
    try(BufferedWriter writer = DataReader.openWriter(parsedArgs.getString("output"))){
      for(HSP hsp: chained){
        writer.write(hsp.toString());
        writer.newLine();
      }
    }
  }

}
