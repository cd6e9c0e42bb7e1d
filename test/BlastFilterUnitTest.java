import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;

public class BlastFilterUnitTest{

  private static final String GOOD = "q1\ts1\t98\t150\t3\t0\t1\t150\t1\t150\t1e-10\t200";

  @Test
  public void testFilter() throws IOException{
    String input = "# header\n" +
        GOOD + "\n" +
        "q2\ts1\t90\t150\t15\t0\t1\t150\t1\t150\t1e-10\t200\n" +
        "q3\ts1\t98\t50\t1\t0\t1\t50\t1\t50\t1e-10\t200\n" +
        "q4\ts1\t98\t150\t3\t0\t1\t150\t1\t150\t0.1\t200\n" +
        "q5\ts1\t98\t150\t3\t0\t1\t150\t150\t1\t1e-10\t20\n";
    StringWriter out = new StringWriter();
    int kept;
    try(BufferedWriter writer = new BufferedWriter(out)){
      kept = new BlastFilter(100, 95, 100, 0.01).filter(new BufferedReader(new StringReader(input)), writer);
    }
    Assert.assertEquals(kept, 1);
    Assert.assertEquals(out.toString(), GOOD + System.lineSeparator());
  }

  @Test
  public void testBoundsInclusive() throws BlastFormatException{
    BlastFilter filter = new BlastFilter(200, 98, 150, 1e-10);
    Assert.assertTrue(filter.accept(BlastParser.parseLine(GOOD)));
  }

  @Test
  public void testFilterFromConfig() throws Exception{
    BlastFilter filter = new BlastFilter(Constants.loadConfig(null));
    Assert.assertTrue(filter.accept(BlastParser.parseLine(GOOD)));
    Assert.assertFalse(filter.accept(BlastParser.parseLine("q1\ts1\t94.9\t150\t3\t0\t1\t150\t1\t150\t1e-10\t200")));
    Assert.assertEquals(filter.getDefaultOutPath("hits.blast"), "hits.blast.P95L100");
  }

  @Test
  public void testDefaultOutPath(){
    Assert.assertEquals(new BlastFilter(0, 97.5, 50, 1).getDefaultOutPath("hits.blast"), "hits.blast.P97.5L50");
  }

  @Test(expectedExceptions = BlastFormatException.class)
  public void testMalformedLine() throws IOException{
    StringWriter out = new StringWriter();
    try(BufferedWriter writer = new BufferedWriter(out)){
      new BlastFilter(0, 0, 0, 1).filter(new BufferedReader(new StringReader(GOOD + "\nq1\ts1\n")), writer);
    }
  }

}
