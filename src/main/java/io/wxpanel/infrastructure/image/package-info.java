/**
 * ImageIO-backed decoding and file storage for backgrounds, overlays, and output canvases.
 */
package io.wxpanel.infrastructure.image;
