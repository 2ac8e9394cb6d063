package com.phillippitts.feedercontrol.exception;

/**
 * Wraps any failure raised by a job body. The worker logs it and moves on to its next iteration.
 */
public class TransientJobException extends FeederControlException {

    private final String jobName;

    public TransientJobException(String jobName, Throwable cause) {
        super("Job " + jobName + " failed: " + cause, cause);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
