/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.render;

import java.util.List;

/**
 * Fastify plugin: {@code fastify.register(require('./tollgate-plugin'))}.
 *
 * <p>Checks run in {@code onRequest}; usage is committed in {@code onResponse} for 2xx replies.
 * The plugin is wrapped with {@code fastify-plugin} so its hooks apply to the whole instance.
 */
public final class FastifyRenderer extends JavaScriptRenderer {

    private static final String ADAPTER = """
            async function tollgatePlugin(fastify, options) {
              const audit = options.audit || defaultAuditHook();
              fastify.decorateRequest('tollgate', null);

              fastify.addHook('onRequest', async (request, reply) => {
                const check = checkRequest({
                  agent_id: request.headers['x-agent-id'],
                  wallet_address: request.headers['x-wallet-address'],
                  ip_address: request.ip,
                }, request.headers[COST_HEADER], audit);
                if (check.decision === null || !check.decision.allowed) {
                  const response = check.decision === null ? INVALID_COST : rejection(check.decision);
                  return reply.code(response.status).headers(response.headers).send(response.body);
                }
                request.tollgate = check;
              });

              fastify.addHook('onResponse', async (request, reply) => {
                const check = request.tollgate;
                if (check !== null && reply.statusCode >= 200 && reply.statusCode < 300) {
                  commit(check.attributes, check.cost, check.now);
                }
              });
            }

            module.exports = fp(tollgatePlugin, { name: 'tollgate' });
            """;

    @Override
    public String name() {
        return "fastify";
    }

    @Override
    public String fileName() {
        return "tollgate-plugin.js";
    }

    @Override
    protected List<String> requires() {
        return List.of("const fp = require('fastify-plugin');");
    }

    @Override
    protected void renderAdapter(SourceWriter out) {
        out.block(ADAPTER);
    }
}
