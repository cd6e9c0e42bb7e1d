import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

public class DataReaderUnitTest{

  private static String resourcePath(String name) throws URISyntaxException{
    return new File(DataReaderUnitTest.class.getResource(name).toURI()).getPath();
  }

  private static File tempFile(String suffix, String... lines) throws IOException{
    File file = File.createTempFile("reads", suffix);
    file.deleteOnExit();
    Files.write(file.toPath(), Arrays.asList(lines));
    return file;
  }

  @Test
  public void testReadSam() throws Exception{
    String path = resourcePath("/pairs.sam");
    Assert.assertTrue(DataReader.isSam(path));
    ArrayList<Location> reads = DataReader.readSam(path, 0);
    Assert.assertEquals(reads.size(), 4);
    Location first = reads.get(0);
    Assert.assertEquals(first.name, "r1/1");
    Assert.assertEquals(first.seqID, "chr1");
    Assert.assertEquals(first.start, 100);
    Assert.assertEquals(first.end, 150);
    Assert.assertEquals(first.strand, '+');
    Assert.assertEquals(first.score, 60.0);
    Location second = reads.get(1);
    Assert.assertEquals(second.name, "r1/2");
    Assert.assertEquals(second.start, 350);
    Assert.assertEquals(second.end, 400);
    Assert.assertEquals(second.strand, '-');
    Assert.assertEquals(reads.get(3).seqID, "chr2");
  }

  @Test
  public void testSamPairs() throws Exception{
    ArrayList<Location> reads = DataReader.readSam(resourcePath("/pairs.sam"), 0);
    MatePairStats stats = new MatePairAnalyzer(1000, null, 1, 20, DistanceMode.OUTER,
        new Logger(System.err)).analyze(reads);
    Assert.assertEquals(stats.pairNum, 2);
    Assert.assertEquals(stats.getLinkNum(), 1);
    Assert.assertEquals(stats.linkedPairs.get(0).distance, 301);
    Assert.assertEquals(stats.linkedPairs.get(0).orientation, "+-");
  }

  @Test
  public void testRowLimit() throws Exception{
    Assert.assertEquals(DataReader.readSam(resourcePath("/pairs.sam"), 3).size(), 3);
    File blast = tempFile(".blast",
        "# comment",
        "r1/1\tchr1\t100\t50\t0\t0\t1\t50\t101\t150\t1e-20\t90",
        "r1/2\tchr1\t100\t50\t0\t0\t1\t50\t400\t351\t1e-20\t90",
        "r2/1\tchr1\t100\t50\t0\t0\t1\t50\t1\t50\t1e-20\t90");
    Assert.assertEquals(DataReader.readProjections(blast.getPath(), 2).size(), 2);
    Assert.assertEquals(DataReader.readProjections(blast.getPath(), 0).size(), 3);
  }

  @Test
  public void testReadProjections() throws IOException{
    File blast = tempFile(".blast",
        "r1/2\tchr1\t100\t50\t0\t0\t1\t50\t400\t351\t1e-20\t90");
    Location read = DataReader.readProjections(blast.getPath(), 0).get(0);
    Assert.assertEquals(read.toBedLine(), "chr1\t350\t400\tr1/2\t90\t-");
  }

  @Test
  public void testReadBed() throws IOException{
    File bed = tempFile(".bed",
        "track name=reads",
        "chr1\t100\t150\tr1/1\t60\t+",
        "chr1\t350\t400\tr1/2\t60\t-",
        "chr2\t10\t50\tr2/1");
    Assert.assertTrue(DataReader.isBed(bed.getPath()));
    ArrayList<Location> reads = DataReader.readBed(bed.getPath(), 0);
    Assert.assertEquals(reads.size(), 3);
    Assert.assertEquals(reads.get(1).strand, '-');
    Assert.assertEquals(reads.get(2).strand, '+');
    Assert.assertEquals(reads.get(2).score, 0.0);
    Assert.assertEquals(reads.get(2).toBedLine(), "chr2\t10\t50\tr2/1\t0\t+");
  }

  @Test(expectedExceptions = IOException.class)
  public void testBadBedLine() throws IOException{
    DataReader.readBed(tempFile(".bed", "chr1\t100\tr1/1").getPath(), 0);
  }

  @Test
  public void testWriterCreatesFolders() throws IOException{
    File dir = Files.createTempDirectory("out").toFile();
    File out = new File(new File(dir, "nested"), "lines.txt");
    try(BufferedWriter writer = DataReader.openWriter(out.getPath())){
      writer.write("line");
    }
    Assert.assertEquals(Files.readAllLines(out.toPath()), Arrays.asList("line"));
    out.delete();
    out.getParentFile().delete();
    dir.delete();
  }

  @Test
  public void testUnknownBedStrand() throws IOException{
    File bed = tempFile(".bed",
        "chr1\t0\t10\tr/1\t0\t.",
        "chr1\t100\t110\tr/2\t0\t.");
    ArrayList<Location> reads = DataReader.readBed(bed.getPath(), 0);
    Assert.assertEquals(reads.get(0).strand, '+');
    Assert.assertEquals(reads.get(1).strand, '+');
    MatePairStats stats = new MatePairAnalyzer(1000, "++", 1, 20, DistanceMode.OUTER,
        new Logger(System.err)).analyze(reads);
    Assert.assertEquals(stats.getLinkNum(), 1);
    Assert.assertEquals(stats.orientations.keySet(), Collections.singleton("++"));
  }

}
