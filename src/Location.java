/**
 * Named feature located on a sequence: a read alignment, a BED line or a projected hit.
 * Coordinates are 0-based, end exclusive.
 */
class Location extends Interval{

  final String name;
  final double score;

  Location(String seqID, int start, int end, char strand, String name, double score){
    super(seqID, start, end, strand);
    this.name = name;
    this.score = score;
  }

  String toBedLine(String scoreText){
    return seqID + '\t' + start + '\t' + end + '\t' + name + '\t' + scoreText + '\t' + strand;
  }

  String toBedLine(){
    return toBedLine(formatNumber(score));
  }

}
