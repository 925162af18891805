package org.gamboni.eslideshow.playback;

import lombok.Setter;
import org.gamboni.eslideshow.data.PlaybackError;
import org.gamboni.eslideshow.spotify.CredentialException;
import org.gamboni.eslideshow.spotify.RemoteApiException;
import org.gamboni.eslideshow.tech.DiagnosticLog;
import org.gamboni.eslideshow.tech.process.PlayerProcessException;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/** Web API plumbing shared by the backends that send commands through the Web API. */
abstract class AbstractPlaybackBackend implements PlaybackBackend {

    /** A blocking Web API request. */
    protected interface RemoteCall {
        void run() throws IOException, CredentialException;
    }

    protected final Executor io;
    protected final DiagnosticLog.Component log;

    @Setter
    protected volatile Listener listener = Listener.NOOP;

    protected AbstractPlaybackBackend(Executor io, DiagnosticLog.Component log) {
        this.io = io;
        this.log = log;
    }

    /** Run the given request on the I/O executor, reporting failures to the listener. */
    protected CompletableFuture<Void> callApi(String description, RemoteCall call) {
        return reportFailure(description, onIo(call));
    }

    /** Run the given request on the I/O executor. */
    protected CompletableFuture<Void> onIo(RemoteCall call) {
        return CompletableFuture.runAsync(() -> {
            try {
                call.run();
            } catch (IOException | CredentialException e) {
                throw new CompletionException(e);
            }
        }, io);
    }

    protected <T> CompletableFuture<T> reportFailure(String description, CompletableFuture<T> future) {
        return future.whenComplete((result, error) -> {
            if (error != null) {
                PlaybackError playbackError = toPlaybackError("Failed to " + description, unwrap(error));
                log.error(playbackError.message());
                listener.error(playbackError);
            }
        });
    }

    protected static Throwable unwrap(Throwable error) {
        return (error instanceof CompletionException && error.getCause() != null) ? error.getCause() : error;
    }

    protected static PlaybackError toPlaybackError(String context, Throwable error) {
        if (error instanceof CredentialException credential) {
            return new PlaybackError(
                    credential.getKind() == CredentialException.Kind.NOT_AUTHENTICATED
                            ? PlaybackError.Kind.UNAUTHORIZED
                            : PlaybackError.Kind.NETWORK,
                    context + ": " + credential.getMessage());
        } else if (error instanceof RemoteApiException remote) {
            return new PlaybackError(
                    remote.getStatusCode() == 401 ? PlaybackError.Kind.UNAUTHORIZED : PlaybackError.Kind.BACKEND,
                    context + ": " + remote);
        } else if (error instanceof PlayerProcessException process) {
            return new PlaybackError(PlaybackError.Kind.PROCESS, context + ": " + process.getMessage());
        } else if (error instanceof DeviceNotFoundException) {
            return new PlaybackError(PlaybackError.Kind.DEVICE_NOT_FOUND, context + ": " + error.getMessage());
        } else if (error instanceof BackendNotReadyException) {
            return PlaybackError.notReady();
        } else if (error instanceof IOException) {
            return new PlaybackError(PlaybackError.Kind.NETWORK, context + ": " + error.getMessage());
        } else {
            return PlaybackError.backend(context + ": " + error);
        }
    }
}
