import java.util.ArrayList;
import java.util.List;

/**
 * HSPs of one query and subject pair chained together.
 */
class Cluster{

  ArrayList<HSP> hsps;

  Cluster(){
    hsps = new ArrayList<>();
  }

  Cluster(List<HSP> hsps){
    this.hsps = new ArrayList<>(hsps);
  }

  void addHSP(HSP hsp){
    hsps.add(hsp);
  }

  int size(){
    return hsps.size();
  }

  HSP get(int i){
    return hsps.get(i);
  }

}
