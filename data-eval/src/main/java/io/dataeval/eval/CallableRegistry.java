package io.dataeval.eval;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only whitelist of callables a literal expression may invoke.
 *
 * <p>The {@link #standard() standard} registry contains exactly {@code datetime} and {@code
 * timedelta}, both registered under module {@code datetime}. Lookups accept the bare name or the
 * module-qualified one, so {@code timedelta(1)} and {@code datetime.timedelta(1)} resolve to the
 * same entry. Instances are immutable and safe to share between threads; {@link #builder()} and
 * {@link #restrictTo(Collection)} always produce new instances.
 */
public final class CallableRegistry {
  private static final Logger log = LoggerFactory.getLogger(CallableRegistry.class);
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /**
   * A registered callable.
   *
   * @param module the module qualifier accepted in dotted callee names, or {@code null}
   * @param name the bare callee name
   * @param callable the constructor
   */
  public record Entry(String module, String name, LiteralCallable callable) {
    public Entry {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(callable, "callable");
    }

    /** The module-qualified name, or the bare name if no module is set. */
    public String qualifiedName() {
      return module == null ? name : module + "." + name;
    }
  }

  private final Map<String, Entry> entries;

  private CallableRegistry(Map<String, Entry> entries) {
    this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    log.debug("Created callable registry with {}", this.entries.keySet());
  }

  private static final class Holder {
    static final CallableRegistry STANDARD =
        builder()
            .register("datetime", "datetime", DateTimeCallables::datetime)
            .register("datetime", "timedelta", DateTimeCallables::timedelta)
            .build();
  }

  /**
   * Returns the process-wide standard registry.
   *
   * @return the registry holding {@code datetime} and {@code timedelta}
   */
  public static CallableRegistry standard() {
    return Holder.STANDARD;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder pre-populated with this registry's entries. */
  public Builder toBuilder() {
    Builder b = new Builder();
    b.entries.putAll(entries);
    return b;
  }

  /**
   * Resolves a callee name.
   *
   * @param callee a bare name such as {@code timedelta} or a qualified one such as {@code
   *     datetime.timedelta}
   * @return the entry, or empty if the callee is not whitelisted
   */
  public Optional<Entry> lookup(String callee) {
    if (callee == null) {
      return Optional.empty();
    }
    int dot = callee.lastIndexOf('.');
    if (dot < 0) {
      return Optional.ofNullable(entries.get(callee));
    }
    Entry entry = entries.get(callee.substring(dot + 1));
    String module = callee.substring(0, dot);
    if (entry == null || entry.module() == null || !entry.module().equals(module)) {
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  public boolean contains(String callee) {
    return lookup(callee).isPresent();
  }

  /** Bare names of all registered callables, in registration order. */
  public Set<String> names() {
    return entries.keySet();
  }

  /**
   * Derives a registry holding only the given names.
   *
   * @param names bare names to keep
   * @return a new registry
   * @throws IllegalArgumentException if a name is not registered here
   */
  public CallableRegistry restrictTo(Collection<String> names) {
    Map<String, Entry> kept = new LinkedHashMap<>();
    for (String name : names) {
      Entry entry = entries.get(name);
      if (entry == null) {
        throw new IllegalArgumentException("Unknown callable: " + name);
      }
      kept.put(name, entry);
    }
    return new CallableRegistry(kept);
  }

  @Override
  public String toString() {
    return "CallableRegistry" + entries.keySet();
  }

  /** Collects entries for a new registry. */
  public static final class Builder {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(String name, LiteralCallable callable) {
      return register(null, name, callable);
    }

    /**
     * Registers a callable.
     *
     * @param module module qualifier for dotted callee names, or {@code null}
     * @param name the bare callee name
     * @param callable the constructor
     * @return this builder
     * @throws IllegalArgumentException if a name is not an identifier or is already registered
     */
    public Builder register(String module, String name, LiteralCallable callable) {
      if (name == null || !IDENTIFIER.matcher(name).matches()) {
        throw new IllegalArgumentException("Invalid callable name: " + name);
      }
      if (module != null && !IDENTIFIER.matcher(module).matches()) {
        throw new IllegalArgumentException("Invalid module name: " + module);
      }
      if (entries.containsKey(name)) {
        throw new IllegalArgumentException("Callable already registered: " + name);
      }
      entries.put(name, new Entry(module, name, callable));
      return this;
    }

    public CallableRegistry build() {
      return new CallableRegistry(entries);
    }
  }
}
