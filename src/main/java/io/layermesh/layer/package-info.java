/**
 * Layers and the query round-trip.
 *
 * <p>{@link io.layermesh.layer.Layer} owns registration, lifecycle, forking, batching and the
 * send/receive sides of a query. Envelopes travel through a
 * {@link io.layermesh.layer.QueryTransport}; {@link io.layermesh.layer.DirectTransport} keeps
 * both layers in one process.
 */
package io.layermesh.layer;
