/*
 * Copyright (c) 2025 Tollgate Policy Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.tollgate.policyengine.codegen.render;

import com.tollgate.policyengine.api.model.Decision;
import com.tollgate.policyengine.api.model.Rule;
import com.tollgate.policyengine.api.model.SubjectField;
import com.tollgate.policyengine.codegen.ir.CanonicalJson;
import com.tollgate.policyengine.codegen.ir.EnforcementPlan;
import com.tollgate.policyengine.codegen.ir.Stage;
import com.tollgate.policyengine.codegen.ir.StageEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base for Node.js targets. Renders the framework-independent part of the module (embedded
 * rules, window state, the decision procedure and the audit hook) and leaves the framework
 * binding to subclasses.
 *
 * <p>The generated {@code evaluate} function is unrolled from the plan, one block per stage
 * entry, so its checks run in exactly the order of {@link EnforcementPlan#entries()}.
 * Amounts are fixed-point {@code BigInt}s with {@link EnforcementPlan#amountScale()} digits.
 *
 * <p>Generated modules export {@code evaluate}, {@code commit}, {@code resetState},
 * {@code RULES} and {@code FINGERPRINT} next to the framework entry point.
 */
public abstract class JavaScriptRenderer implements FrameworkRenderer {

    static final String COST_HEADER = "x-402-estimated-cost";

    private static final String RUNTIME = """
            const SCALE_FACTOR = 10n ** BigInt(AMOUNT_SCALE);
            const FIELDS = ['agent_id', 'wallet_address', 'ip_address'];

            // Node runs middleware on a single thread; window updates need no locking.
            const rateWindows = new Map();
            const spendingWindows = new Map();

            function subjectAttributes(raw) {
              const attributes = {};
              for (const field of FIELDS) {
                const value = raw[field];
                if (typeof value === 'string' && value.trim() !== '') {
                  attributes[field] = value;
                }
              }
              return attributes;
            }

            function subjectKey(attributes) {
              for (const field of FIELDS) {
                if (attributes[field] !== undefined) {
                  return `${field}=${attributes[field]}`;
                }
              }
              return 'anonymous';
            }

            function matches(pattern, value) {
              return pattern.endsWith('*') ? value.startsWith(pattern.slice(0, -1)) : pattern === value;
            }

            function matchesAny(patterns, value) {
              return value !== undefined && patterns.some((pattern) => matches(pattern, value));
            }

            function specificity(pattern) {
              const wildcard = pattern.endsWith('*');
              return (wildcard ? pattern.length - 1 : pattern.length) * 2 + (wildcard ? 0 : 1);
            }

            function mostSpecific(patterns, value) {
              let best = null;
              for (const pattern of patterns) {
                if (matches(pattern, value) && (best === null || specificity(pattern) > specificity(best))) {
                  best = pattern;
                }
              }
              return best;
            }

            // Costs with more digits than AMOUNT_SCALE are rounded up.
            function toUnits(text) {
              const match = /^(\\d+)(?:\\.(\\d+))?$/.exec(String(text).trim());
              if (match === null) {
                return null;
              }
              const digits = match[2] || '';
              const kept = digits.slice(0, AMOUNT_SCALE).padEnd(AMOUNT_SCALE, '0');
              const roundUp = /[1-9]/.test(digits.slice(AMOUNT_SCALE));
              return BigInt(match[1]) * SCALE_FACTOR + BigInt(kept) + (roundUp ? 1n : 0n);
            }

            function fromUnits(units) {
              const text = units.toString().padStart(AMOUNT_SCALE + 1, '0');
              const whole = text.slice(0, text.length - AMOUNT_SCALE);
              const fraction = text.slice(text.length - AMOUNT_SCALE).replace(/0+$/, '');
              return fraction === '' ? whole : `${whole}.${fraction}`;
            }

            function rateRetryAfter(ruleId, subject, now, maxRequests, windowSeconds) {
              const instants = rateWindows.get(`${ruleId}|${subject}`);
              if (instants === undefined) {
                return 0;
              }
              const windowMillis = windowSeconds * 1000;
              const cutoff = now - windowMillis;
              let count = 0;
              let oldest = Infinity;
              for (const instant of instants) {
                if (instant >= cutoff) {
                  count++;
                  oldest = Math.min(oldest, instant);
                }
              }
              if (count < maxRequests) {
                return 0;
              }
              return Math.max(1, Math.ceil((oldest + windowMillis - now) / 1000));
            }

            function recordRequest(ruleId, subject, now, windowSeconds) {
              const key = `${ruleId}|${subject}`;
              const cutoff = now - windowSeconds * 1000;
              const instants = (rateWindows.get(key) || []).filter((instant) => instant >= cutoff);
              instants.push(now);
              rateWindows.set(key, instants);
            }

            function currentSpend(ruleId, subject, now, windowSeconds) {
              const window = spendingWindows.get(`${ruleId}|${subject}`);
              if (window === undefined || now - window.start > windowSeconds * 1000) {
                return 0n;
              }
              return window.total;
            }

            function addSpend(ruleId, subject, now, windowSeconds, amount) {
              const key = `${ruleId}|${subject}`;
              let window = spendingWindows.get(key);
              if (window === undefined || now - window.start > windowSeconds * 1000) {
                window = { start: now, total: 0n };
                spendingWindows.set(key, window);
              }
              window.total += amount;
            }

            function spendingExceeded(ruleId, current, limit, currency) {
              const remaining = limit > current ? limit - current : 0n;
              return {
                allowed: false,
                outcome: 'spending_cap_exceeded',
                ruleId,
                spending: {
                  current: fromUnits(current),
                  limit: fromUnits(limit),
                  remaining: fromUnits(remaining),
                  currency,
                },
              };
            }

            function resetState() {
              rateWindows.clear();
              spendingWindows.clear();
            }
            """;

    private static final String RESPONSES = """
            const INVALID_COST = {
              status: 400,
              headers: {},
              body: { allowed: false, reason: 'invalid estimated cost' },
            };

            function rejection(decision) {
              switch (decision.outcome) {
                case 'deny':
                  return {
                    status: 403,
                    headers: {},
                    body: { allowed: false, reason: decision.reason, rule_id: decision.ruleId },
                  };
                case 'rate_limited':
                  return {
                    status: 429,
                    headers: { 'Retry-After': String(decision.retryAfter) },
                    body: {
                      allowed: false,
                      reason: 'rate limit exceeded',
                      retry_after: decision.retryAfter,
                      rule_id: decision.ruleId,
                    },
                  };
                default:
                  return {
                    status: 402,
                    headers: {},
                    body: {
                      allowed: false,
                      reason: 'spending cap exceeded',
                      spending: decision.spending,
                      rule_id: decision.ruleId,
                      payment: {
                        amount: PRICING.amount,
                        currency: PRICING.currency,
                        memo: PRICING.memo_prefix === null ? null : `${PRICING.memo_prefix}${decision.ruleId}`,
                      },
                    },
                  };
              }
            }

            function csvField(value) {
              const text = value === null || value === undefined ? '' : String(value);
              return /[",\\n]/.test(text) ? `"${text.replace(/"/g, '""')}"` : text;
            }

            // Audit hook signature: (subjectKey, ruleId, decision, amount, timestamp) => void
            function defaultAuditHook() {
              if (!AUDIT.enabled) {
                return () => {};
              }
              const write = AUDIT.destination === 'stdout'
                ? (line) => process.stdout.write(`${line}\\n`)
                : (line) => fs.appendFileSync(AUDIT.destination, `${line}\\n`);
              if (AUDIT.format === 'csv') {
                return (subjectKey, ruleId, decision, amount, timestamp) =>
                  write([subjectKey, ruleId, decision, amount, timestamp].map(csvField).join(','));
              }
              return (subjectKey, ruleId, decision, amount, timestamp) =>
                write(JSON.stringify({ subject_key: subjectKey, rule_id: ruleId, decision, amount, timestamp }));
            }

            function checkRequest(raw, costHeader, audit) {
              const attributes = subjectAttributes(raw);
              const cost = toUnits(costHeader === undefined ? '0' : costHeader);
              if (cost === null) {
                return { attributes, cost: null, now: null, decision: null };
              }
              const now = Date.now();
              const decision = evaluate(attributes, cost, now);
              audit(subjectKey(attributes), decision.ruleId, decision.outcome, fromUnits(cost),
                new Date(now).toISOString());
              return { attributes, cost, now, decision };
            }
            """;

    @Override
    public final String render(EnforcementPlan plan, String sourceName) {
        SourceWriter out = new SourceWriter();
        out.line("'use strict';");
        out.line();
        out.line("// Generated by Tollgate from " + commentText(sourceName) + ". Do not edit.");
        out.line("// Policy version " + commentText(plan.version()) + ", rules sha256:" + plan.fingerprint());
        out.line();
        out.line("const fs = require('fs');");
        for (String require : requires()) {
            out.line(require);
        }
        out.line();
        renderConstants(out, plan);
        out.line();
        out.block(RUNTIME);
        out.line();
        renderEvaluate(out, plan);
        out.line();
        renderCommit(out, plan);
        out.line();
        out.block(RESPONSES);
        out.line();
        renderAdapter(out);
        out.line();
        out.line("module.exports.evaluate = evaluate;");
        out.line("module.exports.commit = commit;");
        out.line("module.exports.resetState = resetState;");
        out.line("module.exports.RULES = RULES;");
        out.line("module.exports.FINGERPRINT = FINGERPRINT;");
        return out.toString();
    }

    /**
     * Extra {@code require} lines for the framework binding.
     */
    protected abstract List<String> requires();

    /**
     * Writes the framework entry point and assigns it to {@code module.exports}. It can use
     * {@code checkRequest(raw, costHeader, audit)}, {@code rejection(decision)},
     * {@code INVALID_COST}, {@code commit(attributes, cost, now)}, {@code defaultAuditHook()}
     * and {@code COST_HEADER}.
     */
    protected abstract void renderAdapter(SourceWriter out);

    private static void renderConstants(SourceWriter out, EnforcementPlan plan) {
        out.line("const RULES = " + RULES_BEGIN_MARKER + plan.rulesJson() + RULES_END_MARKER + ";");
        out.line("const FINGERPRINT = " + CanonicalJson.string(plan.fingerprint()) + ";");
        out.line("const PRICING = " + CanonicalJson.pricing(plan.pricing()) + ";");
        out.line("const AUDIT = " + CanonicalJson.audit(plan.audit()) + ";");
        out.line("const AMOUNT_SCALE = " + plan.amountScale() + ";");
        out.line("const COST_HEADER = " + CanonicalJson.string(COST_HEADER) + ";");

        for (Map.Entry<SubjectField, List<StageEntry>> field : allowlistsByField(plan).entrySet()) {
            String union = field.getValue().stream()
                    .map(e -> "...RULES[" + e.ruleIndex() + "].values")
                    .collect(Collectors.joining(", "));
            out.line("const " + allowConstant(field.getKey()) + " = [" + union + "];");
        }
        for (StageEntry entry : plan.entriesFor(Stage.SPENDING_CAP)) {
            BigDecimal limit = entry.ruleAs(Rule.SpendingCap.class).maxAmount();
            out.line("const " + limitConstant(entry) + " = "
                    + limit.movePointRight(plan.amountScale()).toBigIntegerExact() + "n; // "
                    + limit.toPlainString() + " " + commentText(entry.ruleAs(Rule.SpendingCap.class).currency()));
        }
    }

    private static void renderEvaluate(SourceWriter out, EnforcementPlan plan) {
        out.open("function evaluate(attributes, cost, now) {");
        out.line("const subject = subjectKey(attributes);");

        for (StageEntry entry : plan.entriesFor(Stage.DENY)) {
            Rule.Denylist deny = entry.ruleAs(Rule.Denylist.class);
            out.open("if (matchesAny(RULES[" + entry.ruleIndex() + "].values, attributes." + deny.field().key() + ")) {");
            out.line("return " + denyDecision(Decision.REASON_DENYLISTED, entry.ruleId()) + ";");
            out.close("}");
        }

        out.line("const authoritativeMatches = {};");
        for (Map.Entry<SubjectField, List<StageEntry>> field : allowlistsByField(plan).entrySet()) {
            String attribute = "attributes." + field.getKey().key();
            out.open("if (" + attribute + " !== undefined) {");
            out.line("const match = mostSpecific(" + allowConstant(field.getKey()) + ", " + attribute + ");");
            out.open("if (match === null) {");
            out.line("return " + denyDecision(Decision.REASON_NOT_ALLOWLISTED, field.getValue().get(0).ruleId()) + ";");
            out.close("}");
            out.line("authoritativeMatches." + field.getKey().key() + " = match;");
            out.close("}");
        }

        for (StageEntry entry : plan.entriesFor(Stage.RATE_LIMIT)) {
            Rule.RateLimit limit = entry.ruleAs(Rule.RateLimit.class);
            String retryAfter = "retryAfter" + entry.ruleIndex();
            String ruleId = CanonicalJson.string(entry.ruleId());
            out.line("const " + retryAfter + " = rateRetryAfter(" + ruleId + ", subject, now, "
                    + limit.maxRequests() + ", " + limit.windowSeconds() + ");");
            out.open("if (" + retryAfter + " > 0) {");
            out.line("return { allowed: false, outcome: 'rate_limited', retryAfter: " + retryAfter
                    + ", ruleId: " + ruleId + " };");
            out.close("}");
        }

        for (StageEntry entry : plan.entriesFor(Stage.SPENDING_CAP)) {
            Rule.SpendingCap cap = entry.ruleAs(Rule.SpendingCap.class);
            String spent = "spent" + entry.ruleIndex();
            String ruleId = CanonicalJson.string(entry.ruleId());
            out.line("const " + spent + " = currentSpend(" + ruleId + ", subject, now, " + cap.windowSeconds() + ");");
            out.open("if (" + spent + " + cost > " + limitConstant(entry) + ") {");
            out.line("return spendingExceeded(" + ruleId + ", " + spent + ", " + limitConstant(entry) + ", "
                    + CanonicalJson.string(cap.currency()) + ");");
            out.close("}");
        }

        out.line("return { allowed: true, outcome: 'allow', ruleId: null, authoritativeMatches };");
        out.close("}");
    }

    private static void renderCommit(SourceWriter out, EnforcementPlan plan) {
        List<StageEntry> windowed = new ArrayList<>(plan.entriesFor(Stage.RATE_LIMIT));
        windowed.addAll(plan.entriesFor(Stage.SPENDING_CAP));

        out.open("function commit(attributes, cost, now) {");
        if (!windowed.isEmpty()) {
            out.line("const subject = subjectKey(attributes);");
        }
        for (StageEntry entry : windowed) {
            String ruleId = CanonicalJson.string(entry.ruleId());
            if (entry.rule() instanceof Rule.RateLimit limit) {
                out.line("recordRequest(" + ruleId + ", subject, now, " + limit.windowSeconds() + ");");
            } else if (entry.rule() instanceof Rule.SpendingCap cap) {
                out.line("addSpend(" + ruleId + ", subject, now, " + cap.windowSeconds() + ", cost);");
            }
        }
        out.close("}");
    }

    private static Map<SubjectField, List<StageEntry>> allowlistsByField(EnforcementPlan plan) {
        Map<SubjectField, List<StageEntry>> byField = new EnumMap<>(SubjectField.class);
        for (StageEntry entry : plan.entriesFor(Stage.ALLOW)) {
            byField.computeIfAbsent(entry.ruleAs(Rule.Allowlist.class).field(), f -> new ArrayList<>()).add(entry);
        }
        return byField;
    }

    private static String denyDecision(String reason, String ruleId) {
        return "{ allowed: false, outcome: 'deny', reason: " + CanonicalJson.string(reason)
                + ", ruleId: " + CanonicalJson.string(ruleId) + " }";
    }

    private static String commentText(String text) {
        return text.replaceAll("\\R", " ");
    }

    private static String allowConstant(SubjectField field) {
        return "ALLOW_" + field.key().toUpperCase(Locale.ROOT);
    }

    private static String limitConstant(StageEntry entry) {
        return "LIMIT_" + entry.ruleIndex();
    }
}
