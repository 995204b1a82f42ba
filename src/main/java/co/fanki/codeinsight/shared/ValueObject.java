package co.fanki.codeinsight.shared;

import java.io.Serializable;

/**
 * Marker interface for the immutable facts produced by an analysis run.
 *
 * <p>Implementations are records compared by value. They copy incoming
 * collections in their compact constructors so a finished
 * {@code ProjectAnalysis} can be cached and shared between callers
 * without copying on read.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
