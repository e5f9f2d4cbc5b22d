package com.questrail.mdoc.harness.netty;

import com.questrail.mdoc.harness.ControlConnection;
import com.questrail.mdoc.harness.HarnessException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connects to a harness control server. The returned connection owns its event
 * loop and shuts it down on close.
 */
public final class NettyControlClient
{
    private NettyControlClient() {}

    public static ControlConnection connect(InetSocketAddress address, Duration timeout)
    {
        EventLoopGroup group = new NioEventLoopGroup(1);
        AtomicReference<NettyControlConnection> connection = new AtomicReference<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .handler(new ControlChannelInitializer(connection::set,
                        () -> group.shutdownGracefully(0, 1, TimeUnit.SECONDS)));

        ChannelFuture f = bootstrap.connect(address).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new HarnessException("Unable to connect to harness server at " + address, f.cause());
        }
        return connection.get();
    }
}
