package com.verlumen.tradegym.server;

import com.verlumen.tradegym.channel.Endpoint;
import com.verlumen.tradegym.engine.EngineConfig;
import java.time.Duration;

/**
 * Settings of one server session.
 *
 * @param controllerAddress where the server binds for its controller
 * @param dataAddress where the data provider listens
 * @param connectTimeout send timeout on both channels and receive timeout on the data channel
 * @param task id of this session, used in log lines
 * @param dataWaitBudget how long to wait for a data provider that is not ready
 * @param render whether episodes are rendered
 */
public record ServerConfig(
    Endpoint controllerAddress,
    Endpoint dataAddress,
    Duration connectTimeout,
    int task,
    Duration dataWaitBudget,
    boolean render,
    EngineConfig engineConfig) {}
