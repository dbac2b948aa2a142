package com.inkguess.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.DefaultEventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;

import com.inkguess.game.EventLoopScheduler;
import com.inkguess.game.GameSession;
import com.inkguess.handler.LoginHttpHandler;
import com.inkguess.handler.WebSocketFrameHandler;
import com.inkguess.protocol.ConnectionMessageBus;
import com.inkguess.protocol.MessageSerializer;
import com.inkguess.session.ConnectionRegistry;
import com.inkguess.store.InMemoryUserStore;
import com.inkguess.store.InMemoryWordStore;
import com.inkguess.store.WordStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket game server using Netty's NIO.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads that decode frames and write responses
 * - Game Loop: 1 thread that owns the {@link GameSession}; every game event and every
 *   timer tick runs there, one at a time
 */
public class InkGuessServer {

    private static final Logger logger = LoggerFactory.getLogger(InkGuessServer.class);
    public static final String WEBSOCKET_PATH = "/game";

    private final ServerConfig config;
    private final ConnectionRegistry registry;
    private final MessageSerializer serializer;
    private final InMemoryUserStore userStore;
    private final DefaultEventLoop gameLoop;
    private final GameSession gameSession;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public InkGuessServer(ServerConfig config) {
        this(config, openWordStore(config.getStoreUrl()));
    }

    public InkGuessServer(ServerConfig config, WordStore wordStore) {
        this.config = config;
        this.registry = new ConnectionRegistry();
        this.serializer = new MessageSerializer();
        this.userStore = new InMemoryUserStore(config.getTokenTtl());
        this.gameLoop = new DefaultEventLoop();
        this.gameSession = GameSession.builder()
                .registry(registry)
                .bus(new ConnectionMessageBus(registry, serializer))
                .scheduler(new EventLoopScheduler(gameLoop, config.getTickMillis()))
                .loop(gameLoop)
                .wordStore(wordStore)
                .userStore(userStore)
                .maxRounds(config.getMaxRounds())
                .build();
    }

    /**
     * Resolves the store location: {@code memory:} or {@code file:<path>} to a word list.
     */
    static WordStore openWordStore(String storeUrl) {
        if (storeUrl == null || storeUrl.isBlank() || storeUrl.equals("memory:")) {
            return InMemoryWordStore.fromClasspath(InMemoryWordStore.DEFAULT_RESOURCE);
        }
        if (storeUrl.startsWith("file:")) {
            return InMemoryWordStore.fromFile(Path.of(storeUrl.substring("file:".length())));
        }
        throw new IllegalArgumentException("Unsupported store URL: " + storeUrl);
    }

    /**
     * Starts the server and blocks until it is shut down.
     */
    public void start() throws InterruptedException {
        bind();
        try {
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Binds the listen port without blocking.
     */
    public void bind() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Drop connections that stay silent too long
                        pipeline.addLast(new IdleStateHandler(config.getIdleTimeoutSeconds(), 30, 0, TimeUnit.SECONDS));
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));

                        // Login endpoint; everything but the WebSocket upgrade ends here
                        pipeline.addLast(new LoginHttpHandler(userStore, serializer.getObjectMapper(), WEBSOCKET_PATH));

                        pipeline.addLast(new WebSocketServerCompressionHandler());
                        pipeline.addLast(new WebSocketServerProtocolHandler(
                                WEBSOCKET_PATH,
                                null,      // subprotocols
                                true,      // allow extensions
                                65536,     // max frame size
                                false,     // allow mask mismatch
                                true,      // check starting slash
                                10000L     // handshake timeout ms
                        ));
                        pipeline.addLast(new WebSocketFrameHandler(registry, gameSession, gameLoop, serializer));
                    }
                });

        serverChannel = bootstrap.bind(config.getPort()).sync().channel();

        logger.info("Server started on port {}", config.getPort());
        logger.info("WebSocket endpoint: ws://localhost:{}{}", config.getPort(), WEBSOCKET_PATH);
    }

    /**
     * Gracefully shuts down the server: stops accepting connections, then releases
     * the I/O threads and the game loop.
     */
    public void shutdown() {
        logger.info("Shutting down server...");

        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        gameLoop.shutdownGracefully();

        logger.info("Server shutdown complete.");
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public GameSession getGameSession() {
        return gameSession;
    }

    public InMemoryUserStore getUserStore() {
        return userStore;
    }

    public DefaultEventLoop getGameLoop() {
        return gameLoop;
    }

    public ServerConfig getConfig() {
        return config;
    }
}
