package com.meltwater.syncrabbit.transport.rabbit;

import com.meltwater.syncrabbit.transport.TransportException;
import com.meltwater.syncrabbit.transport.TransportException.Kind;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Maps the exceptions of the RabbitMQ java client onto {@link TransportException} kinds.
 *
 * <ul>
 *     <li>a shutdown signal that is a hard error (connection close), socket and EOF errors: {@link Kind#CONNECTION}</li>
 *     <li>an operation on a channel that was closed earlier: {@link Kind#CHANNEL}</li>
 *     <li>a channel close caused by the request itself (404, 406, ...): {@link Kind#PROTOCOL}</li>
 *     <li>rpc and confirm timeouts: {@link Kind#TIMEOUT}</li>
 * </ul>
 */
final class RabbitExceptions {

    private RabbitExceptions() {
    }

    static TransportException translate(String operation, Throwable e) {
        if (e instanceof TransportException) {
            return (TransportException) e;
        }
        ShutdownSignalException signal = findShutdownSignal(e);
        if (signal != null) {
            return fromShutdownSignal(operation, signal, e);
        }
        if (e instanceof TimeoutException || e.getCause() instanceof TimeoutException) {
            return new TransportException(Kind.TIMEOUT, operation + " timed out", e);
        }
        if (e instanceof SocketTimeoutException) {
            // missed heartbeats end up here
            return new TransportException(Kind.CONNECTION, operation + " failed, broker stopped responding", e);
        }
        if (e instanceof SocketException || e instanceof EOFException) {
            return new TransportException(Kind.CONNECTION, operation + " failed, connection lost", e);
        }
        return new TransportException(Kind.PROTOCOL, operation + " failed: " + e.getMessage(), e);
    }

    private static TransportException fromShutdownSignal(String operation, ShutdownSignalException signal, Throwable e) {
        int replyCode = replyCode(signal.getReason());
        if (signal.isHardError()) {
            return new TransportException(Kind.CONNECTION, replyCode, operation + " failed, connection closed: " + signal.getMessage(), e);
        }
        if (signal instanceof AlreadyClosedException) {
            return new TransportException(Kind.CHANNEL, replyCode, operation + " failed, channel already closed: " + signal.getMessage(), e);
        }
        return new TransportException(Kind.PROTOCOL, replyCode, operation + " refused by broker: " + signal.getMessage(), e);
    }

    private static ShutdownSignalException findShutdownSignal(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ShutdownSignalException) {
                return (ShutdownSignalException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static int replyCode(Method reason) {
        if (reason instanceof AMQP.Channel.Close) {
            return ((AMQP.Channel.Close) reason).getReplyCode();
        }
        if (reason instanceof AMQP.Connection.Close) {
            return ((AMQP.Connection.Close) reason).getReplyCode();
        }
        return TransportException.NO_REPLY_CODE;
    }
}
