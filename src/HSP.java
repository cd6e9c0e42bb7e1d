/**
 * One tabular BLAST hit (high-scoring segment pair).
 * Subject coordinates are stored ascending; {@link #reversed} remembers whether they were given
 * in the opposite order. Query coordinates are kept as given.
 */
public class HSP extends Constants{

  final String query;
  final String subject;
  final double identity;
  final int alnLen;
  final int mismatches;
  final int gaps;
  final int startQ;
  final int endQ;
  final int startS;
  final int endS;
  final double eValue;
  final double score;
  final boolean reversed;

  // column text as read, so that parsed values print back unchanged
  private final String identityText;
  private final String eValueText;
  private final String scoreText;

  HSP(String query, String subject, double identity, int alnLen, int mismatches, int gaps,
      int startQ, int endQ, int startS, int endS, double eValue, double score){
    this(query, subject, identity, alnLen, mismatches, gaps, startQ, endQ, startS, endS, eValue, score,
        formatIdentity(identity), formatNumber(eValue), formatNumber(score));
  }

  HSP(String query, String subject, double identity, int alnLen, int mismatches, int gaps,
      int startQ, int endQ, int startS, int endS, double eValue, double score,
      String identityText, String eValueText, String scoreText){
    this.query = query;
    this.subject = subject;
    this.identity = identity;
    this.alnLen = alnLen;
    this.mismatches = mismatches;
    this.gaps = gaps;
    this.startQ = startQ;
    this.endQ = endQ;
    if(startS > endS){
      this.startS = endS;
      this.endS = startS;
      reversed = true;
    }else{
      this.startS = startS;
      this.endS = endS;
      reversed = false;
    }
    this.eValue = eValue;
    this.score = score;
    this.identityText = identityText;
    this.eValueText = eValueText;
    this.scoreText = scoreText;
  }

  char orientation(){
    return reversed ? REVERSE : FORWARD;
  }

  String scoreText(){
    return scoreText;
  }

  String eValueText(){
    return eValueText;
  }

  /**
   * The same hit seen from the subject side.
   */
  HSP swapped(){
    int newStartS = reversed ? endQ : startQ;
    int newEndS = reversed ? startQ : endQ;
    return new HSP(subject, query, identity, alnLen, mismatches, gaps, startS, endS, newStartS, newEndS,
        eValue, score, identityText, eValueText, scoreText);
  }

  /**
   * 0-based half-open location of the hit on the subject, named after the query.
   */
  Location projection(){
    return new Location(subject, startS - 1, endS, orientation(), query, score);
  }

  @Override
  public String toString(){
    StringBuilder builder = new StringBuilder();
    builder.append(query).append('\t');
    builder.append(subject).append('\t');
    builder.append(identityText).append('\t');
    builder.append(alnLen).append('\t');
    builder.append(mismatches).append('\t');
    builder.append(gaps).append('\t');
    builder.append(startQ).append('\t');
    builder.append(endQ).append('\t');
    if(reversed){
      builder.append(endS).append('\t').append(startS).append('\t');
    }else{
      builder.append(startS).append('\t').append(endS).append('\t');
    }
    builder.append(eValueText).append('\t');
    builder.append(scoreText);
    return builder.toString();
  }

}
