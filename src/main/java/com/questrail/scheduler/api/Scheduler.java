package com.questrail.scheduler.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Scheduler
 * -----------------------------------------------------------------------------
 * {@code Scheduler} is the primary façade for registering, controlling and
 * inspecting jobs and triggers held by a scheduling engine.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Lifecycle control (start, standby, shutdown)</li>
 *   <li>Job and trigger registration and removal</li>
 *   <li>Pausing and resuming jobs, triggers and whole groups</li>
 *   <li>Queries over registered keys, details and states</li>
 *   <li>Calendar management</li>
 *   <li>Execution control (manual firing, interruption, error reset)</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Computing fire times or handling misfires</li>
 *   <li>Persisting jobs and triggers</li>
 *   <li>Retrying failed operations</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * Every operation may raise a {@link SchedulerException}. Implementations that
 * talk to a remote engine additionally distinguish:
 * <ul>
 *   <li>{@link SchedulerConnectionException}: no handle to the engine could be obtained</li>
 *   <li>{@link SchedulerCommunicationException}: the call failed in transit</li>
 * </ul>
 * Any other {@code SchedulerException} is the engine's own rejection of the
 * request and is safe to act on without reconnecting.
 *
 * <h2>Threading and Concurrency</h2>
 * This interface makes no guarantees about thread safety. Callers must consult
 * implementation documentation.
 *
 * <h2>Absent values</h2>
 * Lookups that may find nothing return {@link Optional}; collections are never
 * {@code null}.
 */
public interface Scheduler
{
    // -------------------------------------------------------------------------
    // Identity and state
    // -------------------------------------------------------------------------

    String getSchedulerName();

    String getSchedulerInstanceId();

    SchedulerContext getContext();

    /**
     * Returns a snapshot describing the scheduler's settings and capabilities.
     */
    SchedulerMetaData getMetaData();

    /**
     * Returns the executions in progress at the time of the call.
     * <p>
     * The list is not cluster aware: it only covers the engine answering the
     * call.
     */
    List<JobExecutionContext> getCurrentlyExecutingJobs();

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    void start();

    /**
     * Starts the scheduler after {@code delay} has elapsed.
     */
    void startDelayed(Duration delay);

    /**
     * Whether the scheduler has ever been started.
     * <p>
     * This stays {@code true} while the scheduler is in standby and after it has
     * been shut down.
     */
    boolean isStarted();

    /**
     * Temporarily halts the firing of triggers. {@link #start()} resumes firing.
     */
    void standby();

    boolean isInStandbyMode();

    /**
     * Halts the firing of triggers and releases the scheduler's resources. The
     * scheduler cannot be restarted.
     */
    void shutdown();

    /**
     * @param waitForJobsToComplete if {@code true}, returns only after running jobs finish
     */
    void shutdown(boolean waitForJobsToComplete);

    boolean isShutdown();

    // -------------------------------------------------------------------------
    // Local-only configuration
    // -------------------------------------------------------------------------

    /**
     * Sets the factory that produces job instances.
     *
     * @throws UnsupportedLocalOperationException if the engine runs in another process
     */
    void setJobFactory(JobFactory factory);

    /**
     * @throws UnsupportedLocalOperationException if the engine runs in another process
     */
    ListenerManager getListenerManager();

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    /**
     * Adds {@code jobDetail} and schedules it with {@code trigger}.
     *
     * @return the first fire time of the trigger
     * @throws ObjectAlreadyExistsException if the job or trigger already exists
     */
    Instant scheduleJob(JobDetail jobDetail, Trigger trigger);

    /**
     * Schedules an already stored job with {@code trigger}.
     *
     * @return the first fire time of the trigger
     */
    Instant scheduleJob(Trigger trigger);

    void scheduleJobs(Map<JobDetail, Set<? extends Trigger>> triggersAndJobs, boolean replace);

    void scheduleJob(JobDetail jobDetail, Set<? extends Trigger> triggersForJob, boolean replace);

    /**
     * Stores a durable job with no triggers.
     */
    void addJob(JobDetail jobDetail, boolean replace);

    /**
     * @param storeNonDurableWhileAwaitingScheduling permit a non-durable job to be
     *        stored until a trigger is added for it
     */
    void addJob(JobDetail jobDetail, boolean replace, boolean storeNonDurableWhileAwaitingScheduling);

    /**
     * Deletes a job and its triggers.
     *
     * @return {@code true} if the job was found and deleted
     */
    boolean deleteJob(JobKey jobKey);

    /**
     * @return {@code true} only if every job was found and deleted
     */
    boolean deleteJobs(List<JobKey> jobKeys);

    boolean unscheduleJob(TriggerKey triggerKey);

    boolean unscheduleJobs(List<TriggerKey> triggerKeys);

    /**
     * Replaces the trigger stored under {@code triggerKey} with {@code newTrigger}.
     *
     * @return the first fire time of the new trigger, or empty if no trigger was
     *         stored under {@code triggerKey}
     */
    Optional<Instant> rescheduleJob(TriggerKey triggerKey, Trigger newTrigger);

    // -------------------------------------------------------------------------
    // Pause / resume
    // -------------------------------------------------------------------------

    void pauseJob(JobKey jobKey);

    void pauseJobs(GroupMatcher<JobKey> matcher);

    void pauseTrigger(TriggerKey triggerKey);

    void pauseTriggers(GroupMatcher<TriggerKey> matcher);

    void resumeJob(JobKey jobKey);

    void resumeJobs(GroupMatcher<JobKey> matcher);

    void resumeTrigger(TriggerKey triggerKey);

    void resumeTriggers(GroupMatcher<TriggerKey> matcher);

    /**
     * Pauses every trigger. Groups added later are paused as well until
     * {@link #resumeAll()} is called.
     */
    void pauseAll();

    void resumeAll();

    boolean isJobGroupPaused(String groupName);

    boolean isTriggerGroupPaused(String groupName);

    Set<String> getPausedTriggerGroups();

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    List<String> getJobGroupNames();

    List<String> getTriggerGroupNames();

    Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher);

    Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher);

    List<Trigger> getTriggersOfJob(JobKey jobKey);

    Optional<JobDetail> getJobDetail(JobKey jobKey);

    Optional<Trigger> getTrigger(TriggerKey triggerKey);

    /**
     * @return the trigger's state, or {@link TriggerState#NONE} if it does not exist
     */
    TriggerState getTriggerState(TriggerKey triggerKey);

    boolean checkExists(JobKey jobKey);

    boolean checkExists(TriggerKey triggerKey);

    // -------------------------------------------------------------------------
    // Calendars
    // -------------------------------------------------------------------------

    /**
     * @param updateTriggers recompute the fire times of triggers referencing the calendar
     */
    void addCalendar(String calendarName, Calendar calendar, boolean replace, boolean updateTriggers);

    boolean deleteCalendar(String calendarName);

    Optional<Calendar> getCalendar(String calendarName);

    List<String> getCalendarNames();

    // -------------------------------------------------------------------------
    // Execution control
    // -------------------------------------------------------------------------

    /**
     * Fires the job now, using a one-shot trigger.
     */
    void triggerJob(JobKey jobKey);

    /**
     * @param data job data for this firing only; may be {@code null}
     */
    void triggerJob(JobKey jobKey, Map<String, Object> data);

    /**
     * Requests interruption of every running execution of the job.
     *
     * @return {@code true} if at least one execution was found and interrupted
     * @throws UnableToInterruptJobException if interruption failed for any reason
     */
    boolean interrupt(JobKey jobKey);

    /**
     * Requests interruption of one execution identified by its fire instance id.
     *
     * @throws UnableToInterruptJobException if interruption failed for any reason
     */
    boolean interrupt(String fireInstanceId);

    /**
     * Returns a trigger in {@link TriggerState#ERROR} to normal operation.
     */
    void resetTriggerFromErrorState(TriggerKey triggerKey);

    /**
     * Removes all jobs, triggers and calendars.
     */
    void clear();
}
