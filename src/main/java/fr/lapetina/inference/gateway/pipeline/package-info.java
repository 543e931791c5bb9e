/**
 * The request admission pipeline.
 *
 * <p>A {@link fr.lapetina.inference.gateway.pipeline.Stage} receives the request context and
 * a continuation. It either calls the continuation or stops the request by returning a
 * response or throwing a {@link fr.lapetina.inference.gateway.domain.failure.GatewayFailure}.
 * {@link fr.lapetina.inference.gateway.pipeline.ErrorTaxonomy} is the single place a failure
 * becomes a client-visible response.
 */
package fr.lapetina.inference.gateway.pipeline;
