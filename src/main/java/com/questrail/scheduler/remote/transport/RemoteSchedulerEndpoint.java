package com.questrail.scheduler.remote.transport;

import com.questrail.scheduler.api.Calendar;
import com.questrail.scheduler.api.GroupMatcher;
import com.questrail.scheduler.api.JobDetail;
import com.questrail.scheduler.api.JobExecutionContext;
import com.questrail.scheduler.api.JobKey;
import com.questrail.scheduler.api.SchedulerContext;
import com.questrail.scheduler.api.Trigger;
import com.questrail.scheduler.api.TriggerKey;
import com.questrail.scheduler.api.TriggerState;

import java.rmi.Remote;
import java.rmi.RemoteException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * RemoteSchedulerEndpoint
 * -----------------------------------------------------------------------------
 * The operation set a scheduling engine exposes to other processes.
 *
 * <p>Every method may fail in two distinct ways:</p>
 * <ul>
 *   <li>{@link RemoteException}: the call failed in transit. Whether the engine
 *       executed it is unknown.</li>
 *   <li>{@link com.questrail.scheduler.api.SchedulerException} (unchecked): the
 *       engine received the call and rejected it.</li>
 * </ul>
 *
 * <p>Arguments and results cross a process boundary, so they are value types.
 * Results that may be absent are returned as {@code null}; the proxy converts
 * them to {@link java.util.Optional}.</p>
 */
public interface RemoteSchedulerEndpoint extends Remote
{
    // Identity and metadata

    String getSchedulerName() throws RemoteException;

    String getSchedulerInstanceId() throws RemoteException;

    SchedulerContext getSchedulerContext() throws RemoteException;

    /**
     * @return the time the engine was first started, or {@code null} if never started
     */
    Instant getRunningSince() throws RemoteException;

    int getNumberOfJobsExecuted() throws RemoteException;

    String getJobStoreClassName() throws RemoteException;

    boolean supportsPersistence() throws RemoteException;

    boolean isClustered() throws RemoteException;

    String getThreadPoolClassName() throws RemoteException;

    int getThreadPoolSize() throws RemoteException;

    String getVersion() throws RemoteException;

    List<JobExecutionContext> getCurrentlyExecutingJobs() throws RemoteException;

    // Lifecycle

    void start() throws RemoteException;

    void startDelayed(Duration delay) throws RemoteException;

    void standby() throws RemoteException;

    boolean isInStandbyMode() throws RemoteException;

    void shutdown() throws RemoteException;

    void shutdown(boolean waitForJobsToComplete) throws RemoteException;

    boolean isShutdown() throws RemoteException;

    // Registration

    Instant scheduleJob(JobDetail jobDetail, Trigger trigger) throws RemoteException;

    Instant scheduleJob(Trigger trigger) throws RemoteException;

    void scheduleJobs(Map<JobDetail, Set<? extends Trigger>> triggersAndJobs, boolean replace) throws RemoteException;

    void scheduleJob(JobDetail jobDetail, Set<? extends Trigger> triggersForJob, boolean replace) throws RemoteException;

    void addJob(JobDetail jobDetail, boolean replace) throws RemoteException;

    void addJob(JobDetail jobDetail, boolean replace, boolean storeNonDurableWhileAwaitingScheduling)
            throws RemoteException;

    boolean deleteJob(JobKey jobKey) throws RemoteException;

    boolean deleteJobs(List<JobKey> jobKeys) throws RemoteException;

    boolean unscheduleJob(TriggerKey triggerKey) throws RemoteException;

    boolean unscheduleJobs(List<TriggerKey> triggerKeys) throws RemoteException;

    /**
     * @return first fire time of the new trigger, or {@code null} if no trigger was replaced
     */
    Instant rescheduleJob(TriggerKey triggerKey, Trigger newTrigger) throws RemoteException;

    // Pause / resume

    void pauseJob(JobKey jobKey) throws RemoteException;

    void pauseJobs(GroupMatcher<JobKey> matcher) throws RemoteException;

    void pauseTrigger(TriggerKey triggerKey) throws RemoteException;

    void pauseTriggers(GroupMatcher<TriggerKey> matcher) throws RemoteException;

    void resumeJob(JobKey jobKey) throws RemoteException;

    void resumeJobs(GroupMatcher<JobKey> matcher) throws RemoteException;

    void resumeTrigger(TriggerKey triggerKey) throws RemoteException;

    void resumeTriggers(GroupMatcher<TriggerKey> matcher) throws RemoteException;

    void pauseAll() throws RemoteException;

    void resumeAll() throws RemoteException;

    boolean isJobGroupPaused(String groupName) throws RemoteException;

    boolean isTriggerGroupPaused(String groupName) throws RemoteException;

    Set<String> getPausedTriggerGroups() throws RemoteException;

    // Queries

    List<String> getJobGroupNames() throws RemoteException;

    List<String> getTriggerGroupNames() throws RemoteException;

    Set<JobKey> getJobKeys(GroupMatcher<JobKey> matcher) throws RemoteException;

    Set<TriggerKey> getTriggerKeys(GroupMatcher<TriggerKey> matcher) throws RemoteException;

    List<Trigger> getTriggersOfJob(JobKey jobKey) throws RemoteException;

    /** @return the job, or {@code null} */
    JobDetail getJobDetail(JobKey jobKey) throws RemoteException;

    /** @return the trigger, or {@code null} */
    Trigger getTrigger(TriggerKey triggerKey) throws RemoteException;

    TriggerState getTriggerState(TriggerKey triggerKey) throws RemoteException;

    boolean checkExists(JobKey jobKey) throws RemoteException;

    boolean checkExists(TriggerKey triggerKey) throws RemoteException;

    // Calendars

    void addCalendar(String calendarName, Calendar calendar, boolean replace, boolean updateTriggers)
            throws RemoteException;

    boolean deleteCalendar(String calendarName) throws RemoteException;

    /** @return the calendar, or {@code null} */
    Calendar getCalendar(String calendarName) throws RemoteException;

    List<String> getCalendarNames() throws RemoteException;

    // Execution control

    void triggerJob(JobKey jobKey, Map<String, Object> data) throws RemoteException;

    boolean interrupt(JobKey jobKey) throws RemoteException;

    boolean interrupt(String fireInstanceId) throws RemoteException;

    void resetTriggerFromErrorState(TriggerKey triggerKey) throws RemoteException;

    void clear() throws RemoteException;
}
