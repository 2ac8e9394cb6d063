/**
 * Named periodic jobs on dedicated worker threads with hot-reloadable intervals.
 *
 * @see com.phillippitts.feedercontrol.service.scheduler.JobScheduler
 */
package com.phillippitts.feedercontrol.service.scheduler;
