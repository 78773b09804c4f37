/**
 * OkHttp adapters for the issuance feed and chart downloads.
 *
 * <p>Clients skip certificate and host-name verification for the chart host.</p>
 */
package io.wxpanel.infrastructure.http;
