/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.render;

import java.util.List;

/**
 * Express middleware factory: {@code app.use(require('./tollgate-middleware')())}.
 *
 * <p>Usage is committed from the response {@code finish} event when the status is 2xx.
 */
public final class ExpressRenderer extends JavaScriptRenderer {

    private static final String ADAPTER = """
            function tollgate(options = {}) {
              const audit = options.audit || defaultAuditHook();
              return function tollgateMiddleware(req, res, next) {
                const respond = (response) => res.status(response.status).set(response.headers).json(response.body);
                const check = checkRequest({
                  agent_id: req.get('x-agent-id'),
                  wallet_address: req.get('x-wallet-address'),
                  ip_address: req.ip,
                }, req.get(COST_HEADER), audit);
                if (check.decision === null) {
                  respond(INVALID_COST);
                  return;
                }
                if (!check.decision.allowed) {
                  respond(rejection(check.decision));
                  return;
                }
                res.on('finish', () => {
                  if (res.statusCode >= 200 && res.statusCode < 300) {
                    commit(check.attributes, check.cost, check.now);
                  }
                });
                next();
              };
            }

            module.exports = tollgate;
            """;

    @Override
    public String name() {
        return "express";
    }

    @Override
    public String fileName() {
        return "tollgate-middleware.js";
    }

    @Override
    protected List<String> requires() {
        return List.of();
    }

    @Override
    protected void renderAdapter(SourceWriter out) {
        out.block(ADAPTER);
    }
}
