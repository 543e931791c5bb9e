/**
 * Inference Gateway - admission pipeline in front of a single model executor.
 *
 * <p>Every request passes through the same ordered stages before it reaches the model:
 * rate limiting, credential format, body schema, recursive payload sanitization and
 * bounded-concurrency admission. Failures from any stage are rendered by one error
 * taxonomy into a consistent JSON body.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.gateway.GatewayFactory} - builds the wired gateway from
 *       YAML configuration</li>
 *   <li>{@link fr.lapetina.inference.gateway.InferenceGatewayApplication} - standalone HTTP
 *       server with an OpenAI-compatible API</li>
 *   <li>{@link fr.lapetina.inference.gateway.pipeline.GatewayPipeline} - the stage chain</li>
 * </ul>
 *
 * @see fr.lapetina.inference.gateway.pipeline.ErrorTaxonomy
 */
package fr.lapetina.inference.gateway;
