/**
 * Canvas and unit declarations that make up a product layout.
 */
package io.wxpanel.domain.layout;
