import gnu.trove.list.array.TIntArrayList;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;

public class DisjointSetUnitTest{

  @Test
  public void testSingletons(){
    DisjointSet set = new DisjointSet();
    for(int i = 0; i < 4; i++){
      Assert.assertEquals(set.add(), i);
    }
    Assert.assertEquals(set.size(), 4);
    Assert.assertEquals(set.components().size(), 4);
    Assert.assertFalse(set.connected(0, 1));
  }

  @Test
  public void testUnion(){
    DisjointSet set = new DisjointSet(6);
    for(int i = 0; i < 6; i++){
      set.add();
    }
    set.union(4, 1);
    set.union(2, 4);
    set.union(0, 5);
    Assert.assertTrue(set.connected(1, 2));
    Assert.assertTrue(set.connected(5, 0));
    Assert.assertFalse(set.connected(0, 1));
    ArrayList<TIntArrayList> components = set.components();
    Assert.assertEquals(components.size(), 3);
    Assert.assertEquals(components.get(0), new TIntArrayList(new int[]{0, 5}));
    Assert.assertEquals(components.get(1), new TIntArrayList(new int[]{1, 2, 4}));
    Assert.assertEquals(components.get(2), new TIntArrayList(new int[]{3}));
  }

  @Test
  public void testUnionIsIdempotent(){
    DisjointSet set = new DisjointSet();
    set.add();
    set.add();
    set.union(0, 1);
    set.union(1, 0);
    set.union(0, 1);
    Assert.assertEquals(set.components().size(), 1);
  }

}
