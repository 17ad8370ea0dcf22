package com.questrail.scheduler.remote;

import com.questrail.scheduler.api.Calendar;
import com.questrail.scheduler.api.GroupMatcher;
import com.questrail.scheduler.api.JobDetail;
import com.questrail.scheduler.api.JobExecutionContext;
import com.questrail.scheduler.api.JobFactory;
import com.questrail.scheduler.api.JobKey;
import com.questrail.scheduler.api.ListenerManager;
import com.questrail.scheduler.api.Scheduler;
import com.questrail.scheduler.api.SchedulerCallCancelledException;
import com.questrail.scheduler.api.SchedulerContext;
import com.questrail.scheduler.api.SchedulerException;
import com.questrail.scheduler.api.SchedulerMetaData;
import com.questrail.scheduler.api.Trigger;
import com.questrail.scheduler.api.TriggerKey;
import com.questrail.scheduler.api.TriggerState;
import com.questrail.scheduler.api.UnableToInterruptJobException;
import com.questrail.scheduler.api.UnsupportedLocalOperationException;
import com.questrail.scheduler.directory.SchedulerDirectory;
import com.questrail.scheduler.internal.time.SystemWallClock;
import com.questrail.scheduler.internal.time.WallClock;
import com.questrail.scheduler.remote.internal.CallResult;
import com.questrail.scheduler.remote.internal.RemoteAction;
import com.questrail.scheduler.remote.internal.RemoteCall;
import com.questrail.scheduler.remote.internal.RemoteEndpointHandle;
import com.questrail.scheduler.remote.internal.RemoteFailureTranslator;
import com.questrail.scheduler.remote.observability.NullObservabilitySink;
import com.questrail.scheduler.remote.observability.RemoteSchedulerObservabilitySink;
import com.questrail.scheduler.remote.observability.SchedulerDirectoryEvent;
import com.questrail.scheduler.remote.transport.RemoteEndpointFactory;
import com.questrail.scheduler.remote.transport.RemoteSchedulerEndpoint;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * RemoteScheduler
 * =============================================================================
 * {@link Scheduler} implementation that forwards every call to a scheduling
 * engine running in another process.
 *
 * <h2>Call path</h2>
 * <pre>
 *   caller
 *     → cancellation check (thread interrupt status)
 *       → RemoteEndpointHandle.get()        (lazy, cached)
 *         → RemoteSchedulerEndpoint.op(...)
 *           → CallResult                     (Ok / CommunicationFailure / DomainFailure)
 *             → RemoteFailureTranslator      (value, or translated exception)
 *               → caller
 * </pre>
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>Transport failure: handle invalidated, then
 *       {@link com.questrail.scheduler.api.SchedulerCommunicationException}.</li>
 *   <li>Engine rejection: the engine's {@link SchedulerException} unchanged;
 *       the handle is kept.</li>
 *   <li>No handle obtainable:
 *       {@link com.questrail.scheduler.api.SchedulerConnectionException}.</li>
 * </ul>
 * The proxy stays usable after any failure; the next call reconnects if
 * needed. Nothing is retried automatically.
 *
 * <h2>Specialized operations</h2>
 * <ul>
 *   <li>{@link #interrupt(JobKey)} and {@link #interrupt(String)} report every
 *       failure as {@link UnableToInterruptJobException}; the cause tells an
 *       engine refusal from an unreachable engine.</li>
 *   <li>{@link #setJobFactory(JobFactory)} and {@link #getListenerManager()}
 *       fail with {@link UnsupportedLocalOperationException} without touching
 *       the handle.</li>
 *   <li>{@link #shutdown()} removes {@code schedulerId} from the scheduler
 *       directory, but only after the engine acknowledged the shutdown.</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * There is no internal thread. Each operation is a blocking round trip on the
 * caller's thread. Cancellation is cooperative and checked only before
 * dispatch: a call that is already in flight runs to completion. Concurrent
 * callers are supported; see {@link RemoteEndpointHandle} for the handle's
 * threading model.
 */
public class RemoteScheduler implements Scheduler
{
    private final String schedulerId;
    private final SchedulerDirectory directory;
    private final RemoteSchedulerObservabilitySink observabilitySink;
    private final WallClock clock;

    private final RemoteEndpointHandle handle;
    private final RemoteFailureTranslator translator;

    protected RemoteScheduler(String schedulerId,
                              RemoteEndpointFactory endpointFactory,
                              SchedulerDirectory directory,
                              RemoteSchedulerObservabilitySink observabilitySink,
                              WallClock clock)
    {
        this.schedulerId = Objects.requireNonNull(schedulerId, "schedulerId");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.handle = new RemoteEndpointHandle(schedulerId, endpointFactory, observabilitySink, clock);
        this.translator = new RemoteFailureTranslator(schedulerId, handle, observabilitySink, clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Key under which this proxy is known in the scheduler directory.
     */
    public String schedulerId() {
        return schedulerId;
    }

    /**
     * Whether a handle to the remote engine is currently cached. Diagnostic only;
     * the answer may be stale by the time it is read.
     */
    public boolean isConnected() {
        return handle.isConnected();
    }

    // -------------------------------------------------------------------------
    // Identity and state
    // -------------------------------------------------------------------------

    @Override
    public String getSchedulerName() {
        return callInGuard("getSchedulerName", RemoteSchedulerEndpoint::getSchedulerName);
    }

    @Override
    public String getSchedulerInstanceId() {
        return callInGuard("getSchedulerInstanceId", RemoteSchedulerEndpoint::getSchedulerInstanceId);
    }

    @Override
    public SchedulerContext getContext() {
        return callInGuard("getContext", RemoteSchedulerEndpoint::getSchedulerContext);
    }

    /**
     * Assembles the metadata from several endpoint reads issued through a
     * single guarded call, so a transport failure part-way invalidates the
     * handle once.
     */
    @Override
    public SchedulerMetaData getMetaData() {
        return callInGuard("getMetaData", endpoint -> {
            Instant runningSince = endpoint.getRunningSince();
            return new SchedulerMetaData(
                    endpoint.getSchedulerName(),
                    endpoint.getSchedulerInstanceId(),
                    getClass(),
                    true,
                    runningSince != null,
                    endpoint.isInStandbyMode(),
                    endpoint.isShutdown(),
                    Optional.ofNullable(runningSince),
                    endpoint.getNumberOfJobsExecuted(),
                    endpoint.getJobStoreClassName(),
                    endpoint.supportsPersistence(),
                    endpoint.isClustered(),
                    endpoint.getThreadPoolClassName(),
                    endpoint.getThreadPoolSize(),
                    endpoint.getVersion());
        });
    }

    @Override
    public List<JobExecutionContext> getCurrentlyExecutingJobs() {
        return callInGuard("getCurrentlyExecutingJobs", RemoteSchedulerEndpoint::getCurrentlyExecutingJobs);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void start() {
        runInGuard("start", RemoteSchedulerEndpoint::start);
    }

    @Override
    public void startDelayed(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        runInGuard("startDelayed", endpoint -> endpoint.startDelayed(delay));
    }

    /**
     * Derived from the engine's running-since timestamp; the proxy keeps no
     * record of its own calls.
     */
    @Override
    public boolean isStarted() {
        return callInGuard("isStarted", endpoint -> endpoint.getRunningSince() != null);
    }

    @Override
    public void standby() {
        runInGuard("standby", RemoteSchedulerEndpoint::standby);
    }

    @Override
    public boolean isInStandbyMode() {
        return callInGuard("isInStandbyMode", RemoteSchedulerEndpoint::isInStandbyMode);
    }

    @Override
    public void shutdown() {
        runInGuard("shutdown", endpoint -> endpoint.shutdown());
        deregister();
    }

    @Override
    public void shutdown(boolean waitForJobsToComplete) {
        runInGuard("shutdown", endpoint -> endpoint.shutdown(waitForJobsToComplete));
        deregister();
    }

    @Override
    public boolean isShutdown() {
        return callInGuard("isShutdown", RemoteSchedulerEndpoint::isShutdown);
    }

    // -------------------------------------------------------------------------
    // Local-only configuration
    // -------------------------------------------------------------------------

    @Override
    public void setJobFactory(JobFactory factory) {
        throw new UnsupportedLocalOperationException("Operation not supported for remote schedulers.");
    }

    @Override
    public ListenerManager getListenerManager() {
        throw new UnsupportedLocalOperationException("Operation not supported for remote schedulers.");
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    @Override
    public Instant scheduleJob(JobDetail jobDetail, Trigger trigger) {
        return callInGuard("scheduleJob", endpoint -> endpoint.scheduleJob(jobDetail, trigger));
    }

    @Override
    public Instant scheduleJob(Trigger trigger) {
        return callInGuard("scheduleJob", endpoint -> endpoint.scheduleJob(trigger));
    }

    @Override
    public void scheduleJobs(Map<JobDetail, Set<? extends Trigger>> triggersAndJobs, boolean replace) {
        runInGuard("scheduleJobs", endpoint -> endpoint.scheduleJobs(triggersAndJobs, replace));
    }

    @Override
    public void scheduleJob(JobDetail jobDetail, Set<? extends Trigger> triggersForJob, boolean replace) {
        runInGuard("scheduleJob", endpoint -> endpoint.scheduleJob(jobDetail, triggersForJob, replace));
    }

    @Override
    public void addJob(JobDetail jobDetail, boolean replace) {
        runInGuard("addJob", endpoint -> endpoint.addJob(jobDetail, replace));
    }

    @Override
    public void addJob(JobDetail jobDetail, boolean replace, boolean storeNonDurableWhileAwaitingScheduling) {
        runInGuard("addJob",
                endpoint -> endpoint.addJob(jobDetail, replace, storeNonDurableWhileAwaitingScheduling));
    }

    @Override
    public boolean deleteJob(JobKey jobKey) {
        return callInGuard("deleteJob", endpoint -> endpoint.deleteJob(jobKey));
    }

    @Override
    public boolean deleteJobs(List<JobKey> jobKeys) {
        return callInGuard("deleteJobs", endpoint -> endpoint.deleteJobs(jobKeys));
    }

    @Override
    public boolean unscheduleJob(TriggerKey triggerKey) {
        return callInGuard("unscheduleJob", endpoint -> endpoint.unscheduleJob(triggerKey));
    }

    @Override
    public boolean unscheduleJobs(List<TriggerKey> triggerKeys) {
        return callInGuard("unscheduleJobs", endpoint -> endpoint.unscheduleJobs(triggerKeys));
    }

    @Override
    public Optional<Instant> rescheduleJob(TriggerKey triggerKey, Trigger newTrigger) {
        return Optional.ofNullable(
                callInGuard("rescheduleJob", endpoint -> endpoint.rescheduleJob(triggerKey, newTrigger)));
    }

    // -------------------------------------------------------------------------
    // Pause / resume
    // -------------------------------------------------------------------------

    @Override
    public void pauseJob(JobKey jobKey) {
        runInGuard("pauseJob", endpoint -> endpoint.pauseJob(jobKey));
    }

    @Override
    public void pauseJobs(GroupMatcher<JobKey> matcher) {
        runInGuard("pauseJobs", endpoint -> endpoint.pauseJobs(matcher));
    }

    @Override
    public void pauseTrigger(TriggerKey triggerKey) {
        runInGuard("pauseTrigger", endpoint -> endpoint.pauseTrigger(triggerKey));
    }

    @Override
    public void pauseTriggers(GroupMatcher<TriggerKey> matcher) {
        runInGuard("pauseTriggers", endpoint -> endpoint.pauseTriggers(matcher));
    }

    @Override
    public void resumeJob(JobKey jobKey) {
        runInGuard("resumeJob", endpoint -> endpoint.resumeJob(jobKey));
    }

    @Override
    public void resumeJobs(GroupMatcher<JobKey> matcher) {
        runInGuard("resumeJobs", endpoint -> endpoint.resumeJobs(matcher));
    }

    @Override
    public void resumeTrigger(TriggerKey triggerKey) {
        runInGuard("resumeTrigger", endpoint -> endpoint.resumeTrigger(triggerKey));
    }

    @Override
    public void resumeTriggers(GroupMatcher<TriggerKey> matcher) {
        runInGuard("resumeTriggers", endpoint -> endpoint.resumeTriggers(matcher));
    }

    @Override
    public void pauseAll() {
        runInGuard("pauseAll", RemoteSchedulerEndpoint::pauseAll);
    }

    @Override
    public void resumeAll() {
        runInGuard("resumeAll", RemoteSchedulerEndpoint::resumeAll);
    }

    @Override
    public boolean isJobGroupPaused(String groupName) {
        return callInGuard("isJobGroupPaused", endpoint -> endpoint.isJobGroupPaused(groupName));
    }

    @Override
    public boolean isTriggerGroupPaused(String groupName) {
        return callInGuard("isTriggerGroupPaused", endpoint -> endpoint.isTriggerGroupPaused(groupName));
    }

    @Override
    public Set<String> getPausedTriggerGroups() {
        return callInGuard("getPausedTriggerGroups", RemoteSchedulerEndpoint::getPausedTriggerGroups);
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    @Override
    public List<String> getJobGroupNames() {
        return callInGuard("getJobGroupNames", RemoteSchedulerEndpoint::getJobGroupNames);
    }

    @Override
    public List<String> getTriggerGroupNames() {
        return callInGuard("getTriggerGroupNames", RemoteSchedulerEndpoint::getTriggerGroupNames);
    }

    @Override
    public Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) {
        return callInGuard("getJobKeys", endpoint -> endpoint.getJobKeys(matcher));
    }

    @Override
    public Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) {
        return callInGuard("getTriggerKeys", endpoint -> endpoint.getTriggerKeys(matcher));
    }

    @Override
    public List<Trigger> getTriggersOfJob(JobKey jobKey) {
        return callInGuard("getTriggersOfJob", endpoint -> endpoint.getTriggersOfJob(jobKey));
    }

    @Override
    public Optional<JobDetail> getJobDetail(JobKey jobKey) {
        return Optional.ofNullable(callInGuard("getJobDetail", endpoint -> endpoint.getJobDetail(jobKey)));
    }

    @Override
    public Optional<Trigger> getTrigger(TriggerKey triggerKey) {
        return Optional.ofNullable(callInGuard("getTrigger", endpoint -> endpoint.getTrigger(triggerKey)));
    }

    @Override
    public TriggerState getTriggerState(TriggerKey triggerKey) {
        return callInGuard("getTriggerState", endpoint -> endpoint.getTriggerState(triggerKey));
    }

    @Override
    public boolean checkExists(JobKey jobKey) {
        return callInGuard("checkExists", endpoint -> endpoint.checkExists(jobKey));
    }

    @Override
    public boolean checkExists(TriggerKey triggerKey) {
        return callInGuard("checkExists", endpoint -> endpoint.checkExists(triggerKey));
    }

    // -------------------------------------------------------------------------
    // Calendars
    // -------------------------------------------------------------------------

    @Override
    public void addCalendar(String calendarName, Calendar calendar, boolean replace, boolean updateTriggers) {
        runInGuard("addCalendar", endpoint -> endpoint.addCalendar(calendarName, calendar, replace, updateTriggers));
    }

    @Override
    public boolean deleteCalendar(String calendarName) {
        return callInGuard("deleteCalendar", endpoint -> endpoint.deleteCalendar(calendarName));
    }

    @Override
    public Optional<Calendar> getCalendar(String calendarName) {
        return Optional.ofNullable(callInGuard("getCalendar", endpoint -> endpoint.getCalendar(calendarName)));
    }

    @Override
    public List<String> getCalendarNames() {
        return callInGuard("getCalendarNames", RemoteSchedulerEndpoint::getCalendarNames);
    }

    // -------------------------------------------------------------------------
    // Execution control
    // -------------------------------------------------------------------------

    @Override
    public void triggerJob(JobKey jobKey) {
        triggerJob(jobKey, null);
    }

    @Override
    public void triggerJob(JobKey jobKey, Map<String, Object> data) {
        runInGuard("triggerJob", endpoint -> endpoint.triggerJob(jobKey, data));
    }

    @Override
    public boolean interrupt(JobKey jobKey) {
        try {
            return callInGuard("interrupt", endpoint -> endpoint.interrupt(jobKey));
        } catch (SchedulerException e) {
            throw new UnableToInterruptJobException("Unable to interrupt job '" + jobKey + "'.", e);
        }
    }

    @Override
    public boolean interrupt(String fireInstanceId) {
        try {
            return callInGuard("interrupt", endpoint -> endpoint.interrupt(fireInstanceId));
        } catch (SchedulerException e) {
            throw new UnableToInterruptJobException(
                    "Unable to interrupt job with fire instance id '" + fireInstanceId + "'.", e);
        }
    }

    @Override
    public void resetTriggerFromErrorState(TriggerKey triggerKey) {
        runInGuard("resetTriggerFromErrorState", endpoint -> endpoint.resetTriggerFromErrorState(triggerKey));
    }

    @Override
    public void clear() {
        runInGuard("clear", RemoteSchedulerEndpoint::clear);
    }

    // -------------------------------------------------------------------------
    // Guarded call path
    // -------------------------------------------------------------------------

    /**
     * Runs {@code call} against the remote engine and returns its result, or
     * raises the translated failure.
     */
    protected <T> T callInGuard(String operation, RemoteCall<T> call) {
        if (Thread.currentThread().isInterrupted()) {
            throw new SchedulerCallCancelledException(
                    "Call to remote scheduler '" + schedulerId + "' cancelled before dispatch: " + operation);
        }

        RemoteSchedulerEndpoint endpoint = handle.get();
        return translator.translate(operation, CallResult.invoke(endpoint, call));
    }

    protected void runInGuard(String operation, RemoteAction action) {
        callInGuard(operation, action.asCall());
    }

    private void deregister() {
        if (directory.remove(schedulerId, this)) {
            observabilitySink.onDirectoryEvent(new SchedulerDirectoryEvent(
                    clock.now(), schedulerId, SchedulerDirectoryEvent.Kind.REMOVED));
        }
    }

    @Override
    public String toString() {
        return "RemoteScheduler[" + schedulerId + "]";
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private String schedulerId;
        private RemoteEndpointFactory endpointFactory;
        private SchedulerDirectory directory;
        private RemoteSchedulerObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withSchedulerId(String schedulerId) {
            this.schedulerId = schedulerId;
            return this;
        }

        public Builder withEndpointFactory(RemoteEndpointFactory endpointFactory) {
            this.endpointFactory = endpointFactory;
            return this;
        }

        public Builder withDirectory(SchedulerDirectory directory) {
            this.directory = directory;
            return this;
        }

        public Builder withObservabilitySink(RemoteSchedulerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public RemoteScheduler build() {
            Objects.requireNonNull(schedulerId, "schedulerId must be set");
            Objects.requireNonNull(endpointFactory, "endpointFactory must be set");
            Objects.requireNonNull(directory, "directory must be set");
            return new RemoteScheduler(schedulerId, endpointFactory, directory, observabilitySink, wallClock);
        }
    }
}
