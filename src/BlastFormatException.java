import java.io.IOException;

/**
 * Raised for a tabular BLAST line that can not be turned into an {@link HSP}.
 */
public class BlastFormatException extends IOException{

  private final int lineNum;

  BlastFormatException(String message){
    this(message, -1, null);
  }

  BlastFormatException(String message, Throwable cause){
    this(message, -1, cause);
  }

  BlastFormatException(String message, int lineNum, Throwable cause){
    super(lineNum < 0 ? message : "Line " + lineNum + ": " + message, cause);
    this.lineNum = lineNum;
  }

  BlastFormatException atLine(int lineNum){
    return new BlastFormatException(getMessage(), lineNum, getCause());
  }

  int getLineNum(){
    return lineNum;
  }

}
