import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stranded interval on a named sequence.
 */
class Interval extends Constants implements Comparable<Interval>{

  final String seqID;
  final int start;
  final int end;
  final char strand;

  Interval(String seqID, int start, int end, char strand){
    this.seqID = seqID;
    this.start = start;
    this.end = end;
    this.strand = strand;
  }

  @Override
  public int compareTo(Interval interval){
    int res = seqID.compareTo(interval.seqID);
    if(res != 0){
      return res;
    }
    if(start == interval.start){
      return Integer.compare(end, interval.end);
    }
    return (start < interval.start) ? -1 : 1;
  }

  /**
   * Distance between two intervals measured from the one that starts first.
   * Intervals on different sequences are -1 apart. In {@link DistanceMode#EDGE} mode
   * overlapping intervals give a negative distance.
   */
  static int distance(Interval a, Interval b, DistanceMode mode){
    if(!a.seqID.equals(b.seqID)){
      return -1;
    }
    Interval left = a;
    Interval right = b;
    if(a.start > b.start){
      left = b;
      right = a;
    }
    if(mode == DistanceMode.OUTER){
      return right.end - left.start + 1;
    }
    return right.start - left.end - 1;
  }

  /**
   * Strands of the first starting interval and then of the other one, e.g. "+-".
   */
  static String orientation(Interval a, Interval b){
    if(a.seqID.equals(b.seqID) && a.start > b.start){
      return "" + b.strand + a.strand;
    }
    return "" + a.strand + b.strand;
  }

  /**
   * Number of positions covered by the union of closed intervals.
   */
  static long unionLength(List<Interval> intervals){
    if(intervals.isEmpty()){
      return 0;
    }
    ArrayList<Interval> sorted = new ArrayList<>(intervals);
    Collections.sort(sorted);
    long totalLen = 0;
    Interval first = sorted.get(0);
    String curSeqID = first.seqID;
    int curStart = first.start;
    int curEnd = first.end;
    for(Interval interval: sorted){
      if(interval.start > curEnd || !interval.seqID.equals(curSeqID)){
        totalLen += curEnd - curStart + 1;
        curSeqID = interval.seqID;
        curStart = interval.start;
        curEnd = interval.end;
      }else{
        curEnd = Math.max(curEnd, interval.end);
      }
    }
    totalLen += curEnd - curStart + 1;
    return totalLen;
  }

}
