package com.example.threadlog.logs.services;

import com.example.threadlog.logs.EntryFactory;
import com.example.threadlog.logs.LogAggregator;
import com.example.threadlog.logs.handles.LogHandle;
import com.example.threadlog.logs.handles.RequestLog;
import com.example.threadlog.logs.handles.SessionLog;
import com.example.threadlog.logs.models.CallSite;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reports the first stack frame that does not belong to the logging classes.
 *
 * <p>Walking past a known set of classes rather than a fixed number of frames
 * keeps the answer right whether the caller went through a handle, a default
 * {@code *F} method or {@link LogAggregator} directly.</p>
 */
public class StackWalkerCallSiteProvider implements CallSiteProvider {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private final Set<String> skippedClassNames;

    public StackWalkerCallSiteProvider(Collection<Class<?>> skippedClasses) {
        this.skippedClassNames = skippedClasses.stream()
                .map(Class::getName)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static StackWalkerCallSiteProvider forAggregator() {
        return new StackWalkerCallSiteProvider(Set.of(
                StackWalkerCallSiteProvider.class,
                EntryFactory.class,
                LogAggregator.class,
                LogHandle.class,
                RequestLog.class,
                SessionLog.class));
    }

    @Override
    public Optional<CallSite> capture() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !skippedClassNames.contains(frame.getClassName()))
                .findFirst()
                .map(frame -> CallSite.of(
                        frame.getClassName(),
                        frame.getMethodName(),
                        frame.getFileName(),
                        frame.getLineNumber())));
    }
}
