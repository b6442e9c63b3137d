package com.hpcwatch.refresh;

final class MetricQueries {

    static final String SYSTEM_STATUS = "globalSystemStatus";
    static final String POWER_UPTIME = "systemPowerUpTime";
    static final String POWER_WATTS = "redfish_power_powercontrol_power_consumed_watts";
    static final String TOTAL_POWER_WATTS = "sum(" + POWER_WATTS + ")";

    static final String RUNNING_JOBS = "qstat_total_r_jobs";
    static final String QUEUED_JOBS = "qstat_total_q_jobs";
    static final String HELD_JOBS = "qstat_total_h_jobs";
    static final String RUNNING_JOBS_BY_USER = "qstat_running_jobs_by_user";
    static final String RUNNING_JOBS_BY_QUEUE = "qstat_running_jobs_by_queue";
    static final String QUEUED_JOBS_BY_QUEUE = "qstat_que_by_queue";

    static final String NODES_FREE = "pbs_node_count_free";
    static final String NODES_BUSY = "pbs_node_count_busy";
    static final String NODES_OFFLINE = "pbs_node_count_offline";
    static final String NODES_DOWN = "pbs_node_count_down";
    static final String NODE_STATE = "pbs_node_state";
    static final String NODE_GPUS_TOTAL = "pbs_node_gpus_total";
    static final String NODE_GPUS_USED = "pbs_node_gpus_used";
    static final String NODE_MEM_TOTAL = "pbs_node_mem_total";
    static final String NODE_MEM_USED = "pbs_node_mem_used";
    static final String NODE_JOBS = "pbs_node_jobs";

    static final String GPUS_TOTAL = "sum(pbs_node_gpus_total)";
    static final String GPUS_USED = "sum(pbs_node_gpus_used)";

    static final String GPU_UTILIZATION = "(sum(pbs_node_gpus_used) / sum(pbs_node_gpus_total)) * 100";
    static final String MEMORY_UTILIZATION = "(sum(pbs_node_mem_used) / sum(pbs_node_mem_total)) * 100";
    static final String NODE_UTILIZATION = "(pbs_node_count_busy / (pbs_node_count_free + pbs_node_count_busy)) * 100";

    private MetricQueries() {
    }

    static String gpuOccupation(String selector) {
        return "(sum(pbs_node_gpus_used{" + selector + "}) / sum(pbs_node_gpus_total{" + selector + "})) * 100";
    }
}
