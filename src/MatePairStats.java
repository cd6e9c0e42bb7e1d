import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.TreeMap;

/**
 * Insert size summary of a set of mate pairs.
 */
class MatePairStats{

  int fragmentNum;
  int pairNum;
  int cutoff;
  // sorted ascending
  TIntArrayList linkedDistances;
  ArrayList<PairedRead> linkedPairs;
  TreeMap<String, Integer> orientations;
  double mean;
  double stdev;
  double median;
  int p025;
  int p975;

  MatePairStats(){
    linkedDistances = new TIntArrayList();
    linkedPairs = new ArrayList<>();
    orientations = new TreeMap<>();
  }

  int getLinkNum(){
    return linkedDistances.size();
  }

  double getOrientationPercent(String orientation){
    Integer count = orientations.get(orientation);
    return count == null ? 0 : count * 100.0 / getLinkNum();
  }

  static double median(TIntArrayList sorted){
    int n = sorted.size();
    if(n == 0){
      return Double.NaN;
    }
    if(n % 2 == 1){
      return sorted.get(n / 2);
    }
    return (sorted.get(n / 2 - 1) + (double) sorted.get(n / 2)) / 2;
  }

  /**
   * Fills mean, deviation, median and the 95% range from the sorted linked distances.
   * Percentiles are taken by index without interpolation.
   */
  void computeStats(){
    int n = linkedDistances.size();
    if(n == 0){
      return;
    }
    double sum = 0;
    for(int i = 0; i < n; i++){
      sum += linkedDistances.getQuick(i);
    }
    mean = sum / n;
    double sumSqr = 0;
    for(int i = 0; i < n; i++){
      double diff = linkedDistances.getQuick(i) - mean;
      sumSqr += diff * diff;
    }
    stdev = Math.sqrt(sumSqr / n);
    median = median(linkedDistances);
    p025 = linkedDistances.get((int) (n * 0.025));
    p975 = linkedDistances.get((int) (n * 0.975));
  }

}
