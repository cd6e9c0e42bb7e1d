import java.util.Iterator;

/**
 * Source of parsed BLAST hits.
 */
interface HitStore{

  /**
   * Every HSP in input order.
   */
  Iterator<HSP> iterHSPs();

  /**
   * HSPs grouped by query.
   */
  Iterator<BlastHit> iterHits();

}
