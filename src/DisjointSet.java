import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;

import java.util.ArrayList;

/**
 * Union-find over integer handles handed out by {@link #add()}.
 */
class DisjointSet{

  private TIntArrayList parents;

  DisjointSet(){
    parents = new TIntArrayList();
  }

  DisjointSet(int capacity){
    parents = new TIntArrayList(capacity);
  }

  int add(){
    int handle = parents.size();
    parents.add(handle);
    return handle;
  }

  int size(){
    return parents.size();
  }

  int find(int handle){
    int root = handle;
    while(parents.getQuick(root) != root){
      root = parents.getQuick(root);
    }
    while(handle != root){
      int next = parents.getQuick(handle);
      parents.setQuick(handle, root);
      handle = next;
    }
    return root;
  }

  /**
   * Attaches the set of b to the representative of a.
   */
  void union(int a, int b){
    int rootA = find(a);
    int rootB = find(b);
    if(rootA != rootB){
      parents.setQuick(rootB, rootA);
    }
  }

  boolean connected(int a, int b){
    return find(a) == find(b);
  }

  /**
   * Handles grouped by set, sets ordered by their smallest handle.
   */
  ArrayList<TIntArrayList> components(){
    ArrayList<TIntArrayList> res = new ArrayList<>();
    TIntIntHashMap rootToIndex = new TIntIntHashMap();
    for(int handle = 0; handle < parents.size(); handle++){
      int root = find(handle);
      if(rootToIndex.containsKey(root)){
        res.get(rootToIndex.get(root)).add(handle);
      }else{
        rootToIndex.put(root, res.size());
        TIntArrayList component = new TIntArrayList();
        component.add(handle);
        res.add(component);
      }
    }
    return res;
  }

}
