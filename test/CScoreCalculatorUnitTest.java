import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class CScoreCalculatorUnitTest{

  private static ArrayList<HSP> hits(Object[][] pairs){
    ArrayList<HSP> res = new ArrayList<>();
    for(Object[] pair: pairs){
      res.add(new HSP((String) pair[0], (String) pair[1], 100, 100, 0, 0, 1, 100, 1, 100, 1e-10,
          ((Number) pair[2]).doubleValue()));
    }
    return res;
  }

  private static List<String> toLines(List<ScoredPair> pairs){
    ArrayList<String> res = new ArrayList<>();
    for(ScoredPair pair: pairs){
      res.add(pair.toString());
    }
    return res;
  }

  @Test
  public void testReciprocalBestHit(){
    ArrayList<ScoredPair> pairs = new CScoreCalculator(0.9999).computeCScores(hits(new Object[][]{
        {"A", "B", 100}, {"B", "A", 100}}));
    Assert.assertEquals(toLines(pairs), Arrays.asList("A\tB\t1.00", "B\tA\t1.00"));
  }

  @Test
  public void testSingleHit(){
    Assert.assertEquals(toLines(new CScoreCalculator(0.9999).computeCScores(hits(new Object[][]{
        {"A", "B", 100}}))), Arrays.asList("A\tB\t1.00"));
  }

  @Test
  public void testNonReciprocalHitsDropped(){
    ArrayList<ScoredPair> pairs = new CScoreCalculator(0.9999).computeCScores(hits(new Object[][]{
        {"A", "B", 100}, {"A", "C", 50}, {"C", "D", 80}}));
    Assert.assertEquals(toLines(pairs), Arrays.asList("A\tB\t1.00", "C\tD\t1.00"));
  }

  @Test
  public void testLowerCutoff(){
    ArrayList<ScoredPair> pairs = new CScoreCalculator(0.4).computeCScores(hits(new Object[][]{
        {"C", "D", 80}, {"A", "C", 50}, {"A", "B", 100}}));
    Assert.assertEquals(toLines(pairs), Arrays.asList("A\tB\t1.00", "A\tC\t0.50", "C\tD\t1.00"));
  }

  @Test
  public void testCutoffIsExclusive(){
    ArrayList<ScoredPair> pairs = new CScoreCalculator(0.5).computeCScores(hits(new Object[][]{
        {"A", "B", 100}, {"A", "C", 50}}));
    Assert.assertEquals(toLines(pairs), Arrays.asList("A\tB\t1.00"));
  }

  @Test
  public void testRepeatedPairKeepsMaximum(){
    ArrayList<ScoredPair> pairs = new CScoreCalculator(0).computeCScores(hits(new Object[][]{
        {"A", "B", 60}, {"A", "B", 100}, {"A", "B", 30}}));
    Assert.assertEquals(pairs.size(), 1);
    Assert.assertEquals(pairs.get(0).cScore, 1.0);
  }

  @Test
  public void testBestOfOneMemberOnly(){
    // X-Y is the best hit of X, but Y has a better partner
    ArrayList<ScoredPair> pairs = new CScoreCalculator(0).computeCScores(hits(new Object[][]{
        {"X", "Y", 50}, {"Y", "Z", 100}}));
    Assert.assertEquals(toLines(pairs), Arrays.asList("X\tY\t0.50", "Y\tZ\t1.00"));
  }

  @Test
  public void testScoresWithinBounds(){
    ArrayList<ScoredPair> pairs = new CScoreCalculator(0).computeCScores(hits(new Object[][]{
        {"A", "B", 100}, {"A", "C", 12}, {"C", "D", 80}, {"D", "B", 79.5}, {"E", "A", 3}}));
    Assert.assertEquals(pairs.size(), 5);
    for(ScoredPair pair: pairs){
      Assert.assertTrue(pair.cScore > 0 && pair.cScore <= 1, pair.toString());
    }
  }

  @Test
  public void testBestScoreIndex(){
    BestScoreIndex index = BestScoreIndex.build(hits(new Object[][]{
        {"A", "B", 100}, {"C", "A", 120}, {"C", "D", 10}}).iterator());
    Assert.assertEquals(index.getBestScore("A"), 120.0);
    Assert.assertEquals(index.getBestScore("B"), 100.0);
    Assert.assertEquals(index.getBestScore("C"), 120.0);
    Assert.assertEquals(index.getBestScore("D"), 10.0);
    Assert.assertEquals(index.getBestScore("unknown"), 0.0);
    Assert.assertEquals(index.size(), 4);
  }

  @Test
  public void testCutoffFromConfig() throws Exception{
    Assert.assertEquals(new CScoreCalculator(Constants.loadConfig(null)).getCutoff(), 0.9999);
  }

}
