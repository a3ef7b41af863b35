/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * Request-for-quote exchange between requesters and solvers over an Aeron shared channel.
 * <p>
 * A {@link io.ilayer.rfq.RfqRequester} publishes a {@link io.ilayer.rfq.codec.QuoteRequest} on
 * {@link io.ilayer.rfq.identity.Topics#REQUEST_TOPIC}, carrying the bucket derived from its session
 * key. Every {@link io.ilayer.rfq.RfqSolver} listening there prices the request with a
 * {@link io.ilayer.rfq.pricing.PricingEngine} and publishes a
 * {@link io.ilayer.rfq.codec.QuoteResponse} on the topic of that bucket, where only the requester
 * listens.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link io.ilayer.rfq.identity}: session keys, buckets and topic names</li>
 *   <li>{@link io.ilayer.rfq.codec}: binary wire format of requests and responses</li>
 *   <li>{@link io.ilayer.rfq.pricing}: quote computation and the price feed</li>
 *   <li>{@link io.ilayer.rfq.transport}: topic publish/subscribe over one Aeron stream</li>
 *   <li>{@link io.ilayer.rfq.subscription}: subscribe with retry</li>
 * </ul>
 *
 * <h2>Assumptions</h2>
 * <ul>
 *   <li>Delivery is best effort. A request nobody hears gets no answer and the requester times
 *       out.</li>
 *   <li>Buckets are 32 bits. Two live requesters sharing one see each other's responses.</li>
 *   <li>Nothing is persisted. Keys and buckets live as long as the process.</li>
 * </ul>
 */
package io.ilayer.rfq;
