/**
 * Root package for the dataspace-access library.
 *
 * <p>Three cooperating parts let an application download protected resources with short-lived
 * credentials:
 *
 * <ul>
 *   <li>{@link com.example.dataspaceaccess.core.store.UnitOfWorkManager} – binds one transactional
 *       {@link com.example.dataspaceaccess.core.store.UnitOfWork} per thread and scopes commit,
 *       rollback and close around a logical operation.
 *   <li>{@link com.example.dataspaceaccess.core.token.TokenLifecycleManager} – issues access tokens
 *       through an {@link com.example.dataspaceaccess.core.token.IdentityEndpoint}, stores them,
 *       and hands out a valid one on demand.
 *   <li>{@link com.example.dataspaceaccess.core.transfer.TransferClient} – streams large files to
 *       disk with retries, resumption and atomic placement.
 * </ul>
 *
 * <p>{@link com.example.dataspaceaccess.core.http.HttpTransport} holds the retry rules shared by the
 * identity client and the transfer client; {@link
 * com.example.dataspaceaccess.core.config.AccessSettings} and {@link
 * com.example.dataspaceaccess.core.config.StoreSettings} resolve configuration from system
 * properties and environment variables.
 */
package com.example.dataspaceaccess.core;
