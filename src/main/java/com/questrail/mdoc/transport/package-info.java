/**
 * mdoc BLE proximity transport.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>{@code gatt}: port to the platform GATT client</li>
 *   <li>{@code l2cap}: port to connection-oriented sockets, plus a Netty adapter</li>
 *   <li>{@code internal.*}: the link state machine (events, reducer, executor, dispatch)</li>
 *   <li>{@code ble}: {@link com.questrail.mdoc.api.ProximityTransport} on top of the above</li>
 * </ul>
 *
 * <p>Platform adapters are pure translators. They do not interpret the mdoc
 * protocol, keep no link state and never retry. Every callback they
 * deliver becomes a link event; every action the state machine decides on
 * goes back out through them.</p>
 */
package com.questrail.mdoc.transport;
