/*
 * Copyright (c) 2025 Modelweave
 * Licensed under the Apache License, Version 2.0
 */
package com.modelweave.expr.script.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelweave.expr.api.model.ConstraintOutcome;
import com.modelweave.expr.script.config.SandboxConfig;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs constraint code in an isolated GraalJS context.
 *
 * <p>Each call gets a fresh context with no host access, no class lookup,
 * no I/O, no threads and no processes. Data crosses the boundary as JSON
 * text only; the script never sees a Java object. The constraint body is
 * compiled with the {@code Function} constructor, parameterized by the
 * binding names, so bindings are free variables of the body.
 *
 * <p>Execution is bounded twice: by a statement limit enforced by the engine
 * and by a wall-clock timeout after which the context is cancelled.
 */
public class ScriptSandbox implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ScriptSandbox.class.getName());

    static final String RUNNER = """
            (function (payload, body) {
              "use strict";
              const data = JSON.parse(payload);
              const elements = data.elements;
              const helpers = {
                findElementById: function (id) {
                  return elements.find(function (e) { return e.id === id; });
                },
                findElementsByType: function (metaClassId) {
                  return elements.filter(function (e) { return e.modelElementId === metaClassId; });
                }
              };
              const has = function (obj, key) { return Object.prototype.hasOwnProperty.call(obj, key); };
              const resolve = function (name) {
                if (has(data.aliases, name)) return data.values[data.aliases[name]];
                if (has(data.values, name)) return data.values[name];
                if (has(helpers, name)) return helpers[name];
                return globalThis[name];
              };
              const describe = function (value) {
                try { return String(value); } catch (e) { return Object.prototype.toString.call(value); }
              };
              let result;
              try {
                const constraint = Function.apply(null, data.names.concat([body]));
                result = constraint.apply(undefined, data.names.map(resolve));
              } catch (err) {
                result = { valid: false,
                           message: "Runtime error: " + (err && err.message !== undefined ? err.message : describe(err)) };
              }
              const isObject = result !== null && typeof result === "object";
              return {
                type: result === null ? "null" : typeof result,
                text: describe(result),
                hasValid: isObject && ("valid" in result),
                valid: isObject && result.valid === true,
                message: isObject && result.message !== undefined && result.message !== null
                    ? describe(result.message) : null
              };
            })
            """;

    static final String PROBE = """
            (function (parameters, body) {
              try {
                Function.apply(null, JSON.parse(parameters).concat([body]));
                return null;
              } catch (err) {
                return err && err.message !== undefined ? String(err.message) : String(err);
              }
            })
            """;

    private static final String EMPTY_PAYLOAD = "{\"names\":[],\"values\":{},\"aliases\":{},\"elements\":[]}";

    private final SandboxConfig config;
    private final ObjectMapper objectMapper;
    private final Engine engine;
    private final ResourceLimits limits;
    private final ExecutorService executor;

    public ScriptSandbox(SandboxConfig config) {
        this(config, new ObjectMapper());
    }

    public ScriptSandbox(SandboxConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.engine = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .build();
        this.limits = ResourceLimits.newBuilder()
                .statementLimit(config.getMaxStatements(), null)
                .build();
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "script-sandbox-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        warmUp();
        logger.info("Script sandbox ready: " + config);
    }

    /**
     * Runs both wrappers once on the shared engine so the first constraint is
     * not timed against engine initialization.
     */
    private void warmUp() {
        long start = System.nanoTime();
        Context context = newContext();
        try {
            context.eval("js", RUNNER).execute(EMPTY_PAYLOAD, "return true;");
            context.eval("js", PROBE).execute("[]", "return true;");
            logger.fine(() -> "Sandbox engine warmed up in "
                    + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) + " ms");
        } catch (PolyglotException e) {
            logger.log(Level.WARNING, "Sandbox warm-up failed, first evaluation may be slow", e);
        } finally {
            closeQuietly(context, false);
        }
    }

    /**
     * Compiles the body as a function taking the given parameters, without
     * running it.
     *
     * @return null when the body compiles, otherwise the engine's message
     */
    public String compileError(List<String> parameters, String body) {
        Context context = newContext();
        try {
            Value result = context.eval("js", PROBE).execute(objectMapper.writeValueAsString(parameters), body);
            return result.isNull() ? null : result.asString();
        } catch (JsonProcessingException e) {
            return e.getOriginalMessage();
        } catch (PolyglotException e) {
            logger.log(Level.FINE, "Compile probe aborted", e);
            return e.getMessage();
        } finally {
            closeQuietly(context, false);
        }
    }

    /**
     * Runs the constraint body with the given bindings. Never throws.
     */
    public ConstraintOutcome execute(String body, SandboxBindings bindings) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(payload(bindings));
        } catch (JsonProcessingException e) {
            logger.log(Level.WARNING, "Could not serialize sandbox bindings", e);
            return ConstraintOutcome.fail("Runtime error: could not prepare constraint context");
        }

        AtomicReference<Context> running = new AtomicReference<>();
        Future<ConstraintOutcome> future = executor.submit(() -> run(body, payload, running));
        try {
            return future.get(config.getTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warning("Constraint timed out after " + config.getTimeoutMillis() + " ms, cancelling");
            Context context = running.get();
            if (context != null) {
                closeQuietly(context, true);
            }
            future.cancel(true);
            return ConstraintOutcome.fail("Constraint evaluation timed out after " + config.getTimeoutMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ConstraintOutcome.fail("Constraint evaluation was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.WARNING, "Constraint execution failed", cause);
            return ConstraintOutcome.fail("Runtime error: " + cause.getMessage());
        }
    }

    private ConstraintOutcome run(String body, String payload, AtomicReference<Context> running) {
        Context context = newContext();
        running.set(context);
        try {
            Value result = context.eval("js", RUNNER).execute(payload, body);
            return ScriptResultInterpreter.interpret(toScriptResult(result));
        } catch (PolyglotException e) {
            if (e.isCancelled()) {
                logger.warning("Constraint execution cancelled: " + e.getMessage());
                return ConstraintOutcome.fail("Constraint evaluation exceeded its execution limits");
            }
            logger.log(Level.WARNING, "Constraint raised an error", e);
            return ConstraintOutcome.fail("Runtime error: " + e.getMessage());
        } finally {
            closeQuietly(context, false);
        }
    }

    private Map<String, Object> payload(SandboxBindings bindings) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("names", bindings.names());
        payload.put("values", bindings.values());
        payload.put("aliases", bindings.aliases());
        payload.put("elements", bindings.elements());
        return payload;
    }

    static ScriptResult toScriptResult(Value value) {
        Value message = value.getMember("message");
        return new ScriptResult(
                value.getMember("type").asString(),
                value.getMember("text").asString(),
                value.getMember("hasValid").asBoolean(),
                value.getMember("valid").asBoolean(),
                message == null || message.isNull() ? null : message.asString());
    }

    private Context newContext() {
        return Context.newBuilder("js")
                .engine(engine)
                .allowAllAccess(false)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowIO(false)
                .allowNativeAccess(false)
                .allowCreateThread(false)
                .allowCreateProcess(false)
                .option("js.ecmascript-version", config.getEcmascriptVersion())
                .resourceLimits(limits)
                .build();
    }

    private static void closeQuietly(Context context, boolean cancel) {
        try {
            context.close(cancel);
        } catch (PolyglotException | IllegalStateException e) {
            logger.log(Level.FINE, "Sandbox context already closed", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            engine.close();
        } catch (IllegalStateException e) {
            logger.log(Level.FINE, "Engine still had active contexts on close", e);
            engine.close(true);
        }
    }
}
