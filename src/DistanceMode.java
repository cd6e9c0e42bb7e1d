/**
 * How the distance between two intervals is measured.
 */
enum DistanceMode{

  /** from the start of the first interval to the end of the second one */
  OUTER("ss"),
  /** from the end of the first interval to the start of the second one */
  EDGE("ee");

  final String code;

  DistanceMode(String code){
    this.code = code;
  }

  static DistanceMode fromCode(String code){
    for(DistanceMode mode: values()){
      if(mode.code.equals(code)){
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown distance mode '" + code + "', expected ss or ee");
  }

}
