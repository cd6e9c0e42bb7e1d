/**
 * Two mates found on the reference, with the distance and orientation between them.
 */
class PairedRead{

  String name;
  Location r1;
  Location r2;
  int distance;
  String orientation;

  PairedRead(String name, Location r1, Location r2, DistanceMode mode){
    this.name = name;
    this.r1 = r1;
    this.r2 = r2;
    distance = Interval.distance(r1, r2, mode);
    orientation = Interval.orientation(r1, r2);
  }

  String toPairLine(){
    return r1.name + '\t' + r2.name + '\t' + distance;
  }

}
