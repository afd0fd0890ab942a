package me.golemcore.companion.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * A periodic job failed. Carries the job name; the failure never leaves the
 * job boundary.
 */
public class SchedulerJobException extends RuntimeException {

    private final String jobName;

    public SchedulerJobException(String jobName, Throwable cause) {
        super("Job '" + jobName + "' failed: " + cause.getMessage(), cause);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
