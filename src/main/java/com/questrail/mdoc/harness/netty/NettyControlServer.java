package com.questrail.mdoc.harness.netty;

import com.questrail.mdoc.harness.ControlConnection;
import com.questrail.mdoc.harness.HarnessException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyControlServer
 * =============================================================================
 * Listens on the harness control socket and hands out the first accepted
 * connection. Later connections are refused by closing them.
 *
 * <h2>Lifecycle</h2>
 * - {@link #bind(InetSocketAddress)} binds and returns the bound address.
 * - {@link #accept(Duration)} blocks for the single client.
 * - {@link #close()} closes the listening socket and shuts down the event loops.
 */
public final class NettyControlServer implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(NettyControlServer.class);

    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup(1);
    private final CompletableFuture<NettyControlConnection> accepted = new CompletableFuture<>();

    private volatile Channel serverChannel;

    public InetSocketAddress bind(InetSocketAddress address)
    {
        Objects.requireNonNull(address, "address");
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ControlChannelInitializer(this::onAccepted, null));
        try {
            serverChannel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessException("Interrupted while binding " + address, e);
        } catch (RuntimeException e) {
            close();
            throw new HarnessException("Unable to bind " + address, e);
        }
        InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
        log.info("Harness control socket listening on {}", bound);
        return bound;
    }

    private void onAccepted(NettyControlConnection connection)
    {
        if (!accepted.complete(connection)) {
            log.warn("Refusing additional harness client");
            connection.close();
        }
    }

    public ControlConnection accept(Duration timeout)
    {
        try {
            return accepted.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new HarnessException("No harness client within " + timeout, e);
        } catch (ExecutionException e) {
            throw new HarnessException("Accepting harness client failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessException("Interrupted while waiting for a harness client", e);
        }
    }

    @Override
    public void close()
    {
        accepted.completeExceptionally(new HarnessException("Control server closed"));
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
}
