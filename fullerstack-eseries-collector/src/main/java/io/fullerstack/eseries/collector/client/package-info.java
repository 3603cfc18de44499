/**
 * Access to the SANtricity management REST API.
 * <p>
 * Collectors depend on the {@link io.fullerstack.eseries.collector.client.ApiClient}
 * contract only; {@link io.fullerstack.eseries.collector.client.HttpApiClient} is the
 * production implementation.
 */
package io.fullerstack.eseries.collector.client;
