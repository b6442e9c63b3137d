package com.hpcwatch.refresh;

import java.util.Collections;

final class WarehouseQueries {

    private WarehouseQueries() {
    }

    static String gpuUsageByUser(String schema, String jobTable) {
        return "SELECT sa.username, "
                + "COUNT(*) AS num_jobs, "
                + "COALESCE(SUM(jt.gpu_count), 0) AS total_gpus_used, "
                + "COALESCE(AVG(jt.gpu_count), 0) AS avg_gpus_per_job, "
                + "COALESCE(SUM(jt.gpu_time), 0) / 3600.0 AS total_gpu_hours, "
                + "COALESCE(AVG(jt.gpu_time), 0) / 3600.0 AS avg_gpu_hours_per_job "
                + "FROM " + schema + "." + jobTable + " jt "
                + "JOIN " + schema + ".systemaccount sa ON jt.systemaccount_id = sa.id "
                + "WHERE FROM_UNIXTIME(jt.end_time_ts) >= CURDATE() - INTERVAL ? DAY "
                + "AND jt.gpu_count > 0 "
                + "GROUP BY sa.username "
                + "ORDER BY total_gpu_hours DESC "
                + "LIMIT ?";
    }

    static String dailyJobStats(String schema, String jobTable) {
        return "SELECT DATE(FROM_UNIXTIME(end_time_ts)) AS job_date, "
                + "COUNT(*) AS num_jobs, "
                + "COALESCE(SUM(gpu_time), 0) / 3600.0 AS total_gpu_hours "
                + "FROM " + schema + "." + jobTable + " "
                + "WHERE FROM_UNIXTIME(end_time_ts) >= CURDATE() - INTERVAL ? DAY "
                + "AND gpu_count > 0 "
                + "GROUP BY job_date "
                + "ORDER BY job_date DESC";
    }

    static String queueWaitTime(String schema, String jobTable, String waitColumn, int queueCount) {
        String placeholders = String.join(", ", Collections.nCopies(queueCount, "?"));
        return "SELECT DATE_FORMAT(FROM_UNIXTIME(jt.end_time_ts), '%Y-%m-%d') AS date, "
                + "jr.queue AS queue_name, "
                + "COUNT(DISTINCT jt.job_id) AS num_jobs, "
                + "ROUND(SUM(jt.gpu_time) / 3600.0, 1) AS total_gpu_hours, "
                + "ROUND(SUM(jt.gpu_time) / COUNT(*) / 3600.0, 1) AS avg_gpu_hours_per_job, "
                + "ROUND(AVG(jt." + waitColumn + " / 60.0), 1) AS avg_wait_minutes "
                + "FROM " + schema + "." + jobTable + " jt "
                + "INNER JOIN " + schema + ".job_records jr ON jt.job_record_id = jr.job_record_id "
                + "WHERE FROM_UNIXTIME(jt.end_time_ts) >= CURDATE() - INTERVAL ? DAY "
                + "AND jt.gpu_count > 0 "
                + "AND jr.queue IN (" + placeholders + ") "
                + "GROUP BY date, jr.queue "
                + "ORDER BY date DESC, jr.queue";
    }

    static String monthlyGpuHours(String schema, String jobTable) {
        return "SELECT DATE_FORMAT(FROM_UNIXTIME(end_time_ts), '%b %Y') AS month, "
                + "SUM(gpu_count * (end_time_ts - start_time_ts) / 3600.0) AS gpu_hours "
                + "FROM " + schema + "." + jobTable + " "
                + "WHERE end_time_ts >= UNIX_TIMESTAMP(DATE_SUB(NOW(), INTERVAL 2 YEAR)) "
                + "AND gpu_count > 0 "
                + "GROUP BY DATE_FORMAT(FROM_UNIXTIME(end_time_ts), '%Y-%m'), month "
                + "ORDER BY MIN(end_time_ts)";
    }
}
