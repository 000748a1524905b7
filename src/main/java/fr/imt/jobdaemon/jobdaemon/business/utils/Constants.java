package fr.imt.jobdaemon.jobdaemon.business.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Constants {

    public static final String JOB_ID_PREFIX = "job_";
    public static final String EXECUTION_ID_PREFIX = "exec_";

    public static final int DEFAULT_PRIORITY = 5;
    public static final int MAX_PRIORITY = 10;

    public static final int MAX_FRAME_BYTES = 1024 * 1024;

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_MONGO = "mongo";
}
