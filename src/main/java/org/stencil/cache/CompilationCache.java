package org.stencil.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.compiler.api.CompilationException;
import org.stencil.compiler.api.CompilationOptions;
import org.stencil.compiler.api.CompiledArtifact;
import org.stencil.compiler.api.ICompiler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Memoizes compiled artifacts by source identity and option set.
 * <p>
 * Lookups are lock-free. Writes to one key are serialized by one of a fixed set of lock
 * stripes chosen by the key's hash, so a unit is compiled at most once per miss and readers
 * see either the previous or the new artifact, never a partial one. There is no dependency tracking between templates: invalidating a
 * template drops only its own entries.
 */
public final class CompilationCache {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationCache.class);

    static final int LOCK_STRIPES = 64;

    /**
     * Identifies a cache entry.
     *
     * @param sourceId The template identity.
     * @param options The option set the unit starts with.
     */
    public record Key(String sourceId, CompilationOptions options) {
    }

    private final ICompiler compiler;
    private final TemplateLoader loader;
    private final Map<Key, CompiledArtifact> entries = new ConcurrentHashMap<>();
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
    private final AtomicLong compileCount = new AtomicLong();

    /**
     * @param compiler The compiler run on misses.
     * @param loader The source of template text.
     */
    public CompilationCache(ICompiler compiler, TemplateLoader loader) {
        this.compiler = compiler;
        this.loader = loader;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * Returns the cached artifact for the key or compiles and stores it.
     *
     * @param sourceId The template identity.
     * @param options The option set.
     * @return The artifact.
     * @throws CompilationException if loading or compiling fails; nothing is stored then.
     */
    public CompiledArtifact compile(String sourceId, CompilationOptions options) throws CompilationException {
        Key key = new Key(sourceId, options);
        CompiledArtifact cached = entries.get(key);
        if (cached != null) {
            return cached;
        }
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            cached = entries.get(key);
            if (cached != null) {
                return cached;
            }
            CompiledArtifact artifact = load(key);
            entries.put(key, artifact);
            return artifact;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Compiles the unit again and replaces its entry wholesale.
     *
     * @param sourceId The template identity.
     * @param options The option set.
     * @return The new artifact.
     * @throws CompilationException if loading or compiling fails; the previous entry stays then.
     */
    public CompiledArtifact recompile(String sourceId, CompilationOptions options) throws CompilationException {
        Key key = new Key(sourceId, options);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            CompiledArtifact artifact = load(key);
            entries.put(key, artifact);
            return artifact;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry of a template, whatever its option set.
     *
     * @param sourceId The template identity.
     * @return The number of dropped entries.
     */
    public int invalidate(String sourceId) {
        int dropped = 0;
        for (Key key : List.copyOf(entries.keySet())) {
            if (!key.sourceId().equals(sourceId)) {
                continue;
            }
            ReentrantLock lock = lockFor(key);
            lock.lock();
            try {
                if (entries.remove(key) != null) {
                    dropped++;
                }
            } finally {
                lock.unlock();
            }
        }
        LOG.debug("Invalidated {} entries of {}", dropped, sourceId);
        return dropped;
    }

    /**
     * Recompiles every cached unit. A unit that fails keeps its previous artifact.
     *
     * @return The failures, empty if every unit compiled.
     */
    public List<CompilationException> recompileAll() {
        List<CompilationException> failures = new ArrayList<>();
        for (Key key : List.copyOf(entries.keySet())) {
            try {
                recompile(key.sourceId(), key.options());
            } catch (CompilationException e) {
                LOG.warn("Recompiling {} {} failed: {}", key.sourceId(), key.options(), e.getMessage());
                failures.add(e);
            }
        }
        LOG.info("Recompiled {} units, {} failed", entries.size(), failures.size());
        return failures;
    }

    /**
     * @return The number of compiler invocations since creation.
     */
    public long compileCount() {
        return compileCount.get();
    }

    /**
     * @return The number of cached artifacts.
     */
    public int size() {
        return entries.size();
    }

    /**
     * @return The number of locks guarding writes, independent of the number of keys seen.
     */
    int lockCount() {
        return locks.length;
    }

    private ReentrantLock lockFor(Key key) {
        return locks[Math.floorMod(key.hashCode(), locks.length)];
    }

    private CompiledArtifact load(Key key) throws CompilationException {
        TemplateSource source;
        try {
            source = loader.load(key.sourceId());
        } catch (IOException e) {
            throw new CompilationException("Cannot load template " + key.sourceId() + ": " + e.getMessage(), e);
        }
        compileCount.incrementAndGet();
        LOG.debug("Compiling {} with {}", key.sourceId(), key.options());
        return compiler.compile(source.text(), key.sourceId(), key.options());
    }
}
