package com.flyknight.server;

import com.flyknight.config.SyncConfig;
import com.flyknight.handler.MessageRouter;
import com.flyknight.protocol.MessageCodec;
import com.flyknight.session.SessionRegistry;
import com.flyknight.state.GameStateSnapshot;
import com.flyknight.state.GameStateStore;

/**
 * Everything a host worker needs, wired once per server and passed
 * explicitly to each channel handler and to the broadcast loop.
 */
public class ServerContext {

    private final SyncConfig config;
    private final MessageCodec codec;
    private final GameStateStore store;
    private final SessionRegistry registry;
    private final MessageRouter router;

    public ServerContext(SyncConfig config, GameStateSnapshot initialState) {
        this.config = config;
        this.codec = new MessageCodec();
        this.store = new GameStateStore(initialState);
        this.registry = new SessionRegistry(store, config.getMaxPlayers());
        this.router = new MessageRouter(store, registry);
    }

    public SyncConfig getConfig() {
        return config;
    }

    public MessageCodec getCodec() {
        return codec;
    }

    public GameStateStore getStore() {
        return store;
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public MessageRouter getRouter() {
        return router;
    }
}
