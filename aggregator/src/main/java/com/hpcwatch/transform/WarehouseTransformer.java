package com.hpcwatch.transform;

import com.hpcwatch.model.DailyJobStats;
import com.hpcwatch.model.GpuUsageByUser;
import com.hpcwatch.model.MonthlyGpuHours;
import com.hpcwatch.model.QueueWaitTime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Slf4j
@Component
public class WarehouseTransformer {

    public List<GpuUsageByUser> gpuUsageByUser(List<Map<String, Object>> rows) {
        return mapRows("gpu-usage-by-user", rows, row -> new GpuUsageByUser(
                text(row, "username"),
                whole(row, "num_jobs"),
                whole(row, "total_gpus_used"),
                scaled(row, "avg_gpus_per_job", 2),
                scaled(row, "total_gpu_hours", 2),
                scaled(row, "avg_gpu_hours_per_job", 2)));
    }

    public List<DailyJobStats> dailyJobStats(List<Map<String, Object>> rows) {
        return mapRows("job-stats", rows, row -> new DailyJobStats(
                text(row, "job_date"),
                whole(row, "num_jobs"),
                scaled(row, "total_gpu_hours", 2)));
    }

    public List<QueueWaitTime> queueWaitTimes(List<Map<String, Object>> rows) {
        return mapRows("wait-time", rows, row -> new QueueWaitTime(
                text(row, "date"),
                text(row, "queue_name"),
                whole(row, "num_jobs"),
                scaled(row, "total_gpu_hours", 1).doubleValue(),
                scaled(row, "avg_gpu_hours_per_job", 1).doubleValue(),
                scaled(row, "avg_wait_minutes", 1).doubleValue()));
    }

    public List<MonthlyGpuHours> monthlyGpuHours(List<Map<String, Object>> rows) {
        return mapRows("monthly-gpu-hours", rows, row -> new MonthlyGpuHours(
                text(row, "month"),
                scaled(row, "gpu_hours", 1)));
    }

    private <T> List<T> mapRows(String name, List<Map<String, Object>> rows, Function<Map<String, Object>, T> mapper) {
        List<T> mapped = new ArrayList<>(rows.size());
        int dropped = 0;
        for (Map<String, Object> row : rows) {
            try {
                mapped.add(mapper.apply(row));
            } catch (MalformedRowException e) {
                dropped++;
                log.warn("Dropping malformed {} row {}: {}", name, row, e.getMessage());
            }
        }
        if (dropped > 0) {
            log.warn("{}: kept {} rows, dropped {}", name, mapped.size(), dropped);
        }
        return mapped;
    }

    static String text(Map<String, Object> row, String column) {
        Object value = column(row, column);
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        return value.toString();
    }

    static long whole(Map<String, Object> row, String column) {
        return decimal(row, column).longValue();
    }

    static BigDecimal scaled(Map<String, Object> row, String column, int scale) {
        return decimal(row, column).setScale(scale, RoundingMode.HALF_UP);
    }

    private static BigDecimal decimal(Map<String, Object> row, String column) {
        Object value = column(row, column);
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d)) {
                throw new MalformedRowException(column + " is not finite");
            }
            return new BigDecimal(value.toString());
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new MalformedRowException(column + " is not numeric: '" + value + "'");
        }
    }

    private static Object column(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            throw new MalformedRowException("missing " + column);
        }
        return value;
    }

    static class MalformedRowException extends RuntimeException {
        MalformedRowException(String message) {
            super(message);
        }
    }
}
