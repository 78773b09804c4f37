/**
 * <strong>Purpose:</strong> AWT-free pixel model and the image operations of the panel pipeline:
 * white-to-transparency filtering, Lanczos resampling, and alpha-mask editing.
 * <p><strong>Pipeline role:</strong> Domain layer; used by the compositor and the fetch stage.</p>
 * <p><strong>Concurrency:</strong> Images are mutable and single-owner; the operations themselves are
 * stateless.</p>
 *
 * @since 0.1.0
 */
package io.wxpanel.domain.raster;
