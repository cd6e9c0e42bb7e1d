import gnu.trove.map.hash.TObjectIntHashMap;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.NoSuchElementException;

public class BlastSummaryUnitTest{

  private static ArrayList<HSP> parse(String... lines) throws BlastFormatException{
    ArrayList<HSP> res = new ArrayList<>();
    for(String line: lines){
      res.add(BlastParser.parseLine(line));
    }
    return res;
  }

  private static SequenceSizes sizes(String fasta) throws IOException{
    return new SequenceSizes(FastaReader.readSizes(new BufferedReader(new StringReader(fasta))));
  }

  @Test
  public void testSummary() throws BlastFormatException{
    BlastSummary summary = BlastSummary.summarize(parse(
        "q1\ts1\t100\t100\t0\t0\t1\t100\t101\t200\t1e-30\t200",
        "q1\ts1\t90\t100\t10\t0\t150\t51\t250\t151\t1e-20\t150"));
    Assert.assertEquals(summary.queryCovered, 150);
    Assert.assertEquals(summary.subjectCovered, 150);
    Assert.assertEquals(summary.identity, 95.0, 1e-9);
  }

  @Test
  public void testEmptySummary(){
    BlastSummary summary = BlastSummary.summarize(Collections.emptyList());
    Assert.assertEquals(summary.queryCovered, 0);
    Assert.assertEquals(summary.subjectCovered, 0);
    Assert.assertTrue(Double.isNaN(summary.identity));
  }

  @Test
  public void testCompleteness() throws IOException{
    EagerHitStore store = new EagerHitStore(parse(
        "q1\ts1\t100\t100\t0\t0\t1\t100\t11\t110\t1e-30\t200",
        "q2\ts2\t100\t10\t0\t0\t1\t10\t1\t10\t1e-3\t20",
        "q1\ts1\t100\t100\t0\t0\t101\t200\t300\t201\t1e-30\t200"));
    ArrayList<String> lines = BlastSummary.completeness(store, sizes(">s1 first\nACGT\n>s2\nAAA\n"));
    Assert.assertEquals(lines, Arrays.asList("q1\ts1\t10\t-295", "q2\ts2\t0\t-6"));
    lines = BlastSummary.completeness(new EagerHitStore(parse(
        "q1\ts1\t100\t100\t0\t0\t1\t100\t11\t110\t1e-30\t200",
        "q1\ts1\t100\t100\t0\t0\t101\t200\t300\t201\t1e-30\t200")), new SequenceSizes(sizesOf("s1", 1000)));
    Assert.assertEquals(lines, Collections.singletonList("q1\ts1\t10\t701"));
  }

  private static TObjectIntHashMap<String> sizesOf(String seqID, int size){
    TObjectIntHashMap<String> res = new TObjectIntHashMap<>();
    res.put(seqID, size);
    return res;
  }

  @Test(expectedExceptions = NoSuchElementException.class)
  public void testUnknownSubject() throws IOException{
    BlastSummary.completeness(new EagerHitStore(parse("q1\ts9\t100\t10\t0\t0\t1\t10\t1\t10\t1e-3\t20")),
        sizes(">s1\nACGT\n"));
  }

  @Test
  public void testFastaSizes() throws IOException{
    SequenceSizes sizes = sizes(">s1 description\nACGT\nAC\n\n>s2\nAAA\n");
    Assert.assertEquals(sizes.size(), 2);
    Assert.assertEquals(sizes.getSize("s1"), 6);
    Assert.assertEquals(sizes.getSize("s2"), 3);
  }

}
