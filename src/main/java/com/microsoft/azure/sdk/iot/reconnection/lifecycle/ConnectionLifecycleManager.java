// Copyright (c) Microsoft. All rights reserved.
// Licensed under the MIT license. See LICENSE file in the project root for full license information.

package com.microsoft.azure.sdk.iot.reconnection.lifecycle;

import com.microsoft.azure.sdk.iot.reconnection.CancellationToken;
import com.microsoft.azure.sdk.iot.reconnection.ConnectionStatusInfo;
import com.microsoft.azure.sdk.iot.reconnection.IotHubClient;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatus;
import com.microsoft.azure.sdk.iot.reconnection.IotHubConnectionStatusChangeCallback;
import com.microsoft.azure.sdk.iot.reconnection.MessageCallback;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.TransportException;
import com.microsoft.azure.sdk.iot.reconnection.exceptions.UnauthorizedException;
import com.microsoft.azure.sdk.iot.reconnection.transport.OperationResult;
import com.microsoft.azure.sdk.iot.reconnection.transport.RetryOperationHelper;
import com.microsoft.azure.sdk.iot.reconnection.transport.RetryPolicy;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinReconciler;
import com.microsoft.azure.sdk.iot.reconnection.twin.TwinVersionWatermark;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one usable client connected to the hub for the lifetime of the application.
 *
 * <p>The client reports its connection status changes to this manager. While the client is retrying on its own
 * nothing is done; once it gives up, or its credential is rejected, the client is replaced by a new one. Replacing
 * the client happens under a single gate so that concurrent triggers never create two live clients. Every other
 * operation reads the current client without the gate and waits for {@link #isConnected()} through the
 * {@link RetryOperationHelper}.</p>
 *
 * <p>Conditions nothing can recover from, a disabled device or no valid credential left, cancel the application
 * cancellation token.</p>
 */
public class ConnectionLifecycleManager implements IotHubConnectionStatusChangeCallback, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleManager.class);

    private static final long GATE_POLL_INTERVAL_MILLIS = 100;
    static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private static final class ClientHandle
    {
        private final IotHubClient client;
        private final String credential;

        private ClientHandle(IotHubClient client, String credential)
        {
            this.client = client;
            this.credential = credential;
        }
    }

    private final CredentialSet credentials;
    private final IotHubClientFactory clientFactory;
    private final RetryOperationHelper retryOperationHelper;
    private final ConnectionStatusActionResolver actionResolver;
    private final CancellationToken applicationCancellation;
    private final TwinReconciler twinReconciler;
    private final BackgroundTaskTracker backgroundTasks;
    private final ExecutorService ownedExecutor;

    private final AtomicReference<ClientHandle> currentHandle = new AtomicReference<>();
    private final Semaphore initializationGate = new Semaphore(1);
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile MessageCallback messageCallback;
    private volatile Object messageCallbackContext;

    /**
     * Creates a manager that runs its background work on its own thread pool, shut down by {@link #close()}.
     *
     * @param connectionStrings the device connection strings, tried in order
     * @param clientFactory creates the clients
     * @param retryPolicy the policy every operation of the manager is retried with
     * @param applicationCancellation the token cancelled to stop the application, and cancelled by this manager when
     * it cannot recover
     */
    public ConnectionLifecycleManager(
            List<String> connectionStrings,
            IotHubClientFactory clientFactory,
            RetryPolicy retryPolicy,
            CancellationToken applicationCancellation)
    {
        this(
            new CredentialSet(connectionStrings),
            clientFactory,
            new RetryOperationHelper(retryPolicy),
            new ConnectionStatusActionResolver(),
            new TwinVersionWatermark(),
            createExecutor(),
            true,
            applicationCancellation);
    }

    /**
     * @param credentials the candidate credentials
     * @param clientFactory creates the clients
     * @param retryOperationHelper retries the operations of the manager
     * @param actionResolver decides what to do on a connection status change
     * @param watermark the highest applied desired properties version
     * @param executor runs the connection status change handlers. Not shut down by {@link #close()}.
     * @param applicationCancellation the token cancelled to stop the application
     */
    public ConnectionLifecycleManager(
            CredentialSet credentials,
            IotHubClientFactory clientFactory,
            RetryOperationHelper retryOperationHelper,
            ConnectionStatusActionResolver actionResolver,
            TwinVersionWatermark watermark,
            ExecutorService executor,
            CancellationToken applicationCancellation)
    {
        this(credentials, clientFactory, retryOperationHelper, actionResolver, watermark, executor, false, applicationCancellation);
    }

    private ConnectionLifecycleManager(
            CredentialSet credentials,
            IotHubClientFactory clientFactory,
            RetryOperationHelper retryOperationHelper,
            ConnectionStatusActionResolver actionResolver,
            TwinVersionWatermark watermark,
            ExecutorService executor,
            boolean ownsExecutor,
            CancellationToken applicationCancellation)
    {
        if (credentials == null || clientFactory == null || retryOperationHelper == null || actionResolver == null
                || watermark == null || executor == null || applicationCancellation == null)
        {
            throw new IllegalArgumentException("None of the parameters can be null");
        }

        this.credentials = credentials;
        this.clientFactory = clientFactory;
        this.retryOperationHelper = retryOperationHelper;
        this.actionResolver = actionResolver;
        this.applicationCancellation = applicationCancellation;
        this.backgroundTasks = new BackgroundTaskTracker(executor);
        this.ownedExecutor = ownsExecutor ? executor : null;
        this.twinReconciler = new TwinReconciler(this::getClient, this::isConnected, retryOperationHelper, watermark, applicationCancellation);
    }

    private static ExecutorService createExecutor()
    {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable ->
        {
            Thread thread = new Thread(runnable, "azure-iot-sdk-ConnectionLifecycle-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Creates and opens a client if there is none yet or the current one can no longer be used, then subscribes it
     * to cloud to device messages and desired property updates. Does nothing if the current client is usable or the
     * manager is closed.
     *
     * @param cancellationToken the token that aborts the initialization
     * @throws TransportException if the client could not be opened or subscribed, or a non-retryable one if every
     * credential was rejected
     * @throws CancellationException if the token was cancelled
     */
    public void initializeAndSetupClient(CancellationToken cancellationToken) throws TransportException
    {
        this.requireCredential();
        if (!this.shouldClientBeInitialized())
        {
            log.debug("The current client is usable, skipping initialization");
            return;
        }

        this.acquireGate(cancellationToken);
        ClientHandle handle;
        try
        {
            if (!this.shouldClientBeInitialized())
            {
                log.debug("The client was initialized while waiting for the initialization gate");
                return;
            }

            this.requireCredential();

            cancellationToken.throwIfCancellationRequested();
            this.closeCurrentClient();

            String credential = this.credentials.current();
            IotHubClient client = this.clientFactory.create(credential);
            client.setConnectionStatusChangeCallback(this, client);

            handle = new ClientHandle(client, credential);
            this.currentHandle.set(handle);

            log.info("Opening a new client, {} credential(s) available", this.credentials.size());
            client.open();
        }
        finally
        {
            this.initializationGate.release();
        }

        this.subscribe(handle, cancellationToken);
        log.info("Client initialized and subscribed");
    }

    private void requireCredential() throws TransportException
    {
        if (!this.closed.get() && this.credentials.isEmpty())
        {
            throw new TransportException("Every device credential was rejected, no client can be initialized");
        }
    }

    private boolean shouldClientBeInitialized()
    {
        if (this.closed.get())
        {
            return false;
        }

        ClientHandle handle = this.currentHandle.get();
        if (handle == null)
        {
            return true;
        }

        IotHubConnectionStatus status = handle.client.getConnectionStatusInfo().getStatus();
        return status == IotHubConnectionStatus.DISCONNECTED || status == IotHubConnectionStatus.DISABLED;
    }

    private void acquireGate(CancellationToken cancellationToken)
    {
        try
        {
            while (!this.initializationGate.tryAcquire(GATE_POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS))
            {
                cancellationToken.throwIfCancellationRequested();
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            CancellationException cancellationException = new CancellationException("Interrupted while waiting for the initialization gate");
            cancellationException.initCause(e);
            throw cancellationException;
        }

        if (cancellationToken.isCancellationRequested())
        {
            this.initializationGate.release();
            throw new CancellationException("The initialization was cancelled");
        }
    }

    private void closeCurrentClient() throws TransportException
    {
        ClientHandle handle = this.currentHandle.get();
        if (handle == null)
        {
            return;
        }

        try
        {
            handle.client.close();
        }
        catch (UnauthorizedException e)
        {
            // the credential of a replaced client is often no longer valid
            log.debug("Closing the previous client failed, its credential was rejected", e);
        }
    }

    private void subscribe(ClientHandle handle, CancellationToken cancellationToken) throws TransportException
    {
        MessageCallback callback = this.messageCallback;
        if (callback != null)
        {
            handle.client.setMessageCallback(callback, this.messageCallbackContext);
        }

        this.retryOperationHelper.retryTransientExceptions(
                "SubscribeToDesiredProperties",
                () ->
                {
                    if (this.currentHandle.get() != handle)
                    {
                        log.debug("The client was replaced before it subscribed to desired properties");
                        return;
                    }

                    handle.client.subscribeToDesiredProperties(this.twinReconciler, null);
                },
                this::isConnected,
                cancellationToken);
    }

    /**
     * Handles a connection status change of the current client on a background task.
     */
    @Override
    public void execute(ConnectionStatusInfo connectionStatusInfo, Object callbackContext)
    {
        log.info("Connection status changed: {}", connectionStatusInfo);

        if (this.closed.get())
        {
            log.debug("Ignoring the connection status change, the manager is closed");
            return;
        }

        this.backgroundTasks.submit(
                "ConnectionStatusChange-" + connectionStatusInfo.getStatus(),
                () -> this.handleConnectionStatusChange(connectionStatusInfo, callbackContext));
    }

    private void handleConnectionStatusChange(ConnectionStatusInfo connectionStatusInfo, Object callbackContext) throws TransportException
    {
        ClientHandle handle = this.currentHandle.get();
        if (handle == null || handle.client != callbackContext)
        {
            log.debug("Ignoring status {} reported by a client that was replaced", connectionStatusInfo.getStatus());
            return;
        }

        if (handle.client.getConnectionStatusInfo().getStatus() != connectionStatusInfo.getStatus())
        {
            log.debug("Ignoring status {}, the client has moved on since", connectionStatusInfo.getStatus());
            return;
        }

        if (this.closed.get())
        {
            return;
        }

        ConnectionAction action = this.actionResolver.resolve(connectionStatusInfo.getStatus(), connectionStatusInfo.getChangeReason());
        switch (action)
        {
            case RECONCILE_TWIN:
                log.info("The client is connected, checking for missed desired property updates");
                this.twinReconciler.reconcile(this.applicationCancellation);
                break;

            case NONE:
                log.debug("No action needed for status {}", connectionStatusInfo);
                break;

            case DISCARD_CREDENTIAL_AND_REINITIALIZE:
                if (this.credentials.discardIfCurrent(handle.credential))
                {
                    log.warn("The credential was rejected and is discarded, {} credential(s) remain", this.credentials.size());
                }

                if (this.credentials.isEmpty())
                {
                    log.error("No valid credential remains, stopping the application");
                    this.applicationCancellation.cancel();
                    break;
                }

                this.reinitializeClient();
                break;

            case REINITIALIZE:
                log.warn("The client cannot recover on its own ({}), initializing a new one", connectionStatusInfo.getChangeReason());
                this.reinitializeClient();
                break;

            case FATAL:
                log.error("The client cannot recover from {}, stopping the application", connectionStatusInfo, connectionStatusInfo.getCause());
                this.applicationCancellation.cancel();
                break;

            case UNEXPECTED:
            default:
                log.error("Unexpected connection status {}, no action taken", connectionStatusInfo, connectionStatusInfo.getCause());
                break;
        }
    }

    private void reinitializeClient() throws TransportException
    {
        // the new client may fail to open while the network is still down
        this.retryOperationHelper.run(
                "InitializeAndSetupClient",
                () ->
                {
                    try
                    {
                        this.initializeAndSetupClient(this.applicationCancellation);
                        return OperationResult.success();
                    }
                    catch (TransportException e)
                    {
                        // a rejected credential is reported through the status callback and handled there
                        return e.isRetryable() ? OperationResult.transientFailure(e) : OperationResult.fatalFailure(e);
                    }
                },
                () -> true,
                this.applicationCancellation);
    }

    /**
     * @return true if the current client is connected and the manager is not closed
     */
    public boolean isConnected()
    {
        ClientHandle handle = this.currentHandle.get();
        return !this.closed.get()
                && handle != null
                && handle.client.getConnectionStatusInfo().getStatus() == IotHubConnectionStatus.CONNECTED;
    }

    /**
     * @return the current client
     * @throws TransportException a retryable exception if there is no client yet
     */
    public IotHubClient getClient() throws TransportException
    {
        ClientHandle handle = this.currentHandle.get();
        if (handle == null)
        {
            throw TransportException.retryable("No client has been initialized yet", null);
        }

        return handle.client;
    }

    /**
     * Sets the callback for cloud to device messages. It is registered again on every new client.
     *
     * @param callback the callback
     * @param callbackContext a context passed to the callback. Can be null.
     */
    public void setMessageCallback(MessageCallback callback, Object callbackContext)
    {
        this.messageCallbackContext = callbackContext;
        this.messageCallback = callback;

        ClientHandle handle = this.currentHandle.get();
        if (handle != null)
        {
            handle.client.setMessageCallback(callback, callbackContext);
        }
    }

    public RetryOperationHelper getRetryOperationHelper()
    {
        return this.retryOperationHelper;
    }

    public TwinReconciler getTwinReconciler()
    {
        return this.twinReconciler;
    }

    BackgroundTaskTracker getBackgroundTasks()
    {
        return this.backgroundTasks;
    }

    /**
     * Closes the current client and waits for the pending connection status handlers. Later status changes are
     * ignored. Closing a closed manager does nothing.
     *
     * @throws TransportException if the client could not be closed
     */
    @Override
    public void close() throws TransportException
    {
        if (!this.closed.compareAndSet(false, true))
        {
            return;
        }

        log.info("Closing the connection lifecycle manager");

        // the application token is usually cancelled by now, so the cleanup gets its own
        CancellationToken closeToken = CancellationToken.withTimeout(CLOSE_TIMEOUT);
        boolean gateAcquired = false;
        try
        {
            this.acquireGate(closeToken);
            gateAcquired = true;
        }
        catch (CancellationException e)
        {
            log.warn("Timed out waiting for a client initialization to end, closing anyway");
        }

        try
        {
            ClientHandle handle = this.currentHandle.getAndSet(null);
            if (handle != null)
            {
                handle.client.close();
            }
        }
        catch (UnauthorizedException e)
        {
            log.debug("Closing the client failed, its credential was rejected", e);
        }
        finally
        {
            if (gateAcquired)
            {
                this.initializationGate.release();
            }

            this.awaitBackgroundTasks(closeToken);
        }

        log.info("Connection lifecycle manager closed");
    }

    private void awaitBackgroundTasks(CancellationToken closeToken)
    {
        try
        {
            long remainingMillis = closeToken.isCancellationRequested() ? 0 : CLOSE_TIMEOUT.toMillis();
            if (!this.backgroundTasks.awaitCompletion(remainingMillis, TimeUnit.MILLISECONDS))
            {
                log.warn("{} connection status handler(s) still running after close", this.backgroundTasks.getRunningTaskCount());
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the connection status handlers");
        }
        finally
        {
            if (this.ownedExecutor != null)
            {
                this.ownedExecutor.shutdownNow();
            }
        }
    }
}
