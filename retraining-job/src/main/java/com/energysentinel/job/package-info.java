/**
 * Process entry point that runs one retraining cycle or anomaly pass per
 * scheduler invocation.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.energysentinel.job.EnergySentinelJob}: main entry point
 * and exit codes</li>
 * <li>{@link com.energysentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.energysentinel.job.CsvTimeSeriesStore}: CSV-file backed
 * store for local runs</li>
 * <li>{@link com.energysentinel.job.JsonReportNotifier}: logs outcomes and
 * writes JSON reports</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.energysentinel.job;
