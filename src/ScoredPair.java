import java.util.Locale;

/**
 * Query and subject with their C-score.
 */
class ScoredPair{

  final String query;
  final String subject;
  final double cScore;

  ScoredPair(String query, String subject, double cScore){
    this.query = query;
    this.subject = subject;
    this.cScore = cScore;
  }

  @Override
  public String toString(){
    return query + '\t' + subject + '\t' + String.format(Locale.US, "%.2f", cScore);
  }

}
