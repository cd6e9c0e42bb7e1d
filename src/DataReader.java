import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;

import java.io.*;
import java.util.ArrayList;
import java.util.zip.GZIPInputStream;

/**
 * Opens input and output files and reads located features for mate pair analysis.
 */
class DataReader extends Constants{

  static BufferedReader openReader(String path) throws IOException{
    InputStream is;
    if(path.equals("-")){
      is = System.in;
    }else{
      is = new FileInputStream(path);
      if(path.toLowerCase().endsWith(".gz")){
        is = new GZIPInputStream(is, 65536);
      }
    }
    return new BufferedReader(new InputStreamReader(is), 32768);
  }

  /**
   * Writer to the given file, or to standard output when path is null or "-".
   * Closing a standard output writer only flushes it.
   */
  static BufferedWriter openWriter(String path) throws IOException{
    if(path == null || path.equals("-")){
      OutputStream os = new FilterOutputStream(System.out){
        @Override
        public void write(byte[] b, int off, int len) throws IOException{
          out.write(b, off, len);
        }

        @Override
        public void close() throws IOException{
          flush();
        }
      };
      return new BufferedWriter(new OutputStreamWriter(os));
    }
    File parent = new File(path).getAbsoluteFile().getParentFile();
    if(parent != null && !parent.exists()){
      parent.mkdirs();
    }
    return new BufferedWriter(new FileWriter(path));
  }

  static boolean isSam(String path){
    String lower = path.toLowerCase();
    return lower.endsWith(".sam") || lower.endsWith(".bam");
  }

  static boolean isBed(String path){
    String lower = path.toLowerCase();
    return lower.endsWith(".bed") || lower.endsWith(".bed.gz");
  }

  /**
   * Hits projected on their subjects, read name taken from the query.
   */
  static ArrayList<Location> readProjections(String path, int nRows) throws IOException{
    ArrayList<Location> res = new ArrayList<>();
    try(BufferedReader reader = openReader(path)){
      int lineNum = 0;
      for(String line = reader.readLine(); line != null; line = reader.readLine()){
        lineNum++;
        if(BlastParser.isComment(line)){
          continue;
        }
        if(nRows > 0 && res.size() >= nRows){
          break;
        }
        try{
          res.add(BlastParser.parseLine(line).projection());
        }catch(BlastFormatException e){
          throw e.atLine(lineNum);
        }
      }
    }
    return res;
  }

  /**
   * BED lines with at least chrom, start, end and name; score defaults to 0, strand to + unless it is -.
   */
  static ArrayList<Location> readBed(String path, int nRows) throws IOException{
    ArrayList<Location> res = new ArrayList<>();
    try(BufferedReader reader = openReader(path)){
      int lineNum = 0;
      for(String line = reader.readLine(); line != null; line = reader.readLine()){
        lineNum++;
        if(line.trim().isEmpty() || line.startsWith(COMMENT_PREFIX) || line.startsWith("track") ||
            line.startsWith("browser")){
          continue;
        }
        if(nRows > 0 && res.size() >= nRows){
          break;
        }
        String[] fields = line.split("\t");
        if(fields.length < 4){
          throw new IOException("File " + path + " has incorrect BED line " + lineNum + ": '" + line + "'");
        }
        try{
          double score = fields.length > 4 && !fields[4].equals(".") ? Double.parseDouble(fields[4]) : 0;
          // unknown strand (".") counts as forward
          char strand = fields.length > 5 && fields[5].trim().equals("-") ? REVERSE : FORWARD;
          res.add(new Location(fields[0], Integer.parseInt(fields[1].trim()), Integer.parseInt(fields[2].trim()),
              strand, fields[3], score));
        }catch(NumberFormatException e){
          throw new IOException("File " + path + " has incorrect BED line " + lineNum + ": '" + line + "'", e);
        }
      }
    }
    return res;
  }

  /**
   * Mapped primary alignments; mates are told apart by a /1 or /2 suffix added to the read name.
   */
  static ArrayList<Location> readSam(String path, int nRows) throws IOException{
    ArrayList<Location> res = new ArrayList<>();
    SamReaderFactory factory = SamReaderFactory.makeDefault();
    factory.validationStringency(ValidationStringency.SILENT);
    try(SamReader sReader = factory.open(new File(path))){
      for(SAMRecord record: sReader){
        if(record.getReadUnmappedFlag() || record.isSecondaryOrSupplementary()){
          continue;
        }
        if(nRows > 0 && res.size() >= nRows){
          break;
        }
        String name = record.getReadName();
        if(record.getReadPairedFlag()){
          name += record.getFirstOfPairFlag() ? "/1" : "/2";
        }
        char strand = record.getReadNegativeStrandFlag() ? REVERSE : FORWARD;
        res.add(new Location(record.getReferenceName(), record.getAlignmentStart() - 1,
            record.getAlignmentEnd(), strand, name, record.getMappingQuality()));
      }
    }
    return res;
  }

}
