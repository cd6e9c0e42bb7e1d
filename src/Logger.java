import org.jdom2.Document;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;

/**
 * Diagnostic output of the tools: standard error, or the file named by LogPath in the config.
 */
public class Logger{

  String logPath;
  private PrintStream writer;

  private static Logger instance;

  Logger(PrintStream writer){
    this.writer = writer;
    logPath = "";
  }

  private Logger(Document document) throws FileNotFoundException{
    logPath = readLogPath(document);
    if(logPath.isEmpty()){
      writer = System.err;
    }else{
      File logFile = new File(logPath).getAbsoluteFile();
      File outFolder = logFile.getParentFile();
      if(outFolder != null && !outFolder.exists()){
        outFolder.mkdirs();
      }
      writer = new PrintStream(new FileOutputStream(logFile, true), true);
    }
  }

  private static String readLogPath(Document document){
    String logPath = document.getRootElement().getChildText("LogPath");
    return logPath == null ? "" : logPath.trim();
  }

  static Logger getInstance(Document document){
    String logPath = readLogPath(document);
    if(instance == null || !instance.logPath.equals(logPath)){
      if(instance != null){
        instance.close();
      }
      try{
        instance = new Logger(document);
      }catch(FileNotFoundException e){
        throw new IllegalArgumentException("Can not open log file " + logPath, e);
      }
    }
    return instance;
  }

  void printf(String s, Object... args){
    writer.printf(s, args);
  }

  void println(String s){
    writer.println(s);
  }

  void close(){
    if(writer != System.err){
      writer.close();
    }
  }

}
