// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package panprob.util;

import java.util.ArrayList;
import java.util.List;
import panprob.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An entry of the operation trace, for try-with-resources.
 * <p>
 * While a problem is loaded, converted and rendered, each step opens a trace such as "Loading problem 03" or
 * "Converting environment 'choices' at line 12". When a fatal condition reaches the command line front end, it prints
 * {@link #activeTraces()} so the user can tell which problem and which construct failed.
 * <p>
 * Messages are only built when somebody asks for them, which normally never happens. A trace belongs to the thread
 * that opened it.
 */
public final class Trace implements AutoCloseable {
    public Trace(final MessageSupplier supplier) {
        final var context = localContext();
        enclosing = context.innermost;
        this.supplier = supplier;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's open traces, innermost first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localContext().innermost; trace != null; trace = trace.enclosing) {
            result.add(trace.supplier.get());
        }
        return result;
    }

    /**
     * Does nothing; referencing the resource variable keeps "unused resource" warnings quiet.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Traces closed out of order";
        ownerContext.innermost = enclosing;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null, CF can't tell.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace enclosing;
    private final MessageSupplier supplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }
}
