/**
 * Region compositing of a chart onto a canvas.
 */
package io.wxpanel.domain.composite;
