import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;

/**
 * Shared constants and helpers of the BLAST tools.
 */
public class Constants{

  static final int BLAST_COLUMNS = 12;
  static final char FORWARD = '+';
  static final char REVERSE = '-';
  static final String COMMENT_PREFIX = "#";
  static final String DEFAULT_CONFIG = "/config.xml";
  static final String[] MATE_ORIENTATIONS = {"++", "--", "+-", "-+"};
  static final MathContext SIGNIFICANT_DIGITS = new MathContext(12);

  static Document loadConfig(String path) throws JDOMException, IOException{
    SAXBuilder jdomBuilder = new SAXBuilder();
    if(path != null){
      return jdomBuilder.build(path);
    }
    try(InputStream stream = Constants.class.getResourceAsStream(DEFAULT_CONFIG)){
      if(stream == null){
        throw new IOException("Default config " + DEFAULT_CONFIG + " is missing from classpath");
      }
      return jdomBuilder.build(stream);
    }
  }

  static boolean isMateOrientation(String orientation){
    for(String o: MATE_ORIENTATIONS){
      if(o.equals(orientation)){
        return true;
      }
    }
    return false;
  }

  /**
   * Rounded to 12 significant digits, so that sums like 0.1 + 0.2 print as 0.3.
   * Integral values are printed without a fraction, everything else as Java prints doubles.
   */
  static String formatNumber(double value){
    if(Double.isNaN(value) || Double.isInfinite(value)){
      return Double.toString(value);
    }
    double rounded = new BigDecimal(value).round(SIGNIFICANT_DIGITS).doubleValue();
    if(rounded == Math.rint(rounded) && Math.abs(rounded) < 1e15){
      return Long.toString((long) rounded);
    }
    return Double.toString(rounded);
  }

  static String formatIdentity(double identity){
    if(!Double.isInfinite(identity) && identity == Math.rint(identity)){
      return formatNumber(identity);
    }
    return String.format(Locale.US, "%.2f", identity);
  }

}
