package com.valuerank.orchestration.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class RunProgress {

    @Column(name = "progress_total", nullable = false)
    private int total;

    @Column(name = "progress_completed", nullable = false)
    private int completed;

    @Column(name = "progress_failed", nullable = false)
    private int failed;

    protected RunProgress() {
    }

    private RunProgress(int total, int completed, int failed) {
        if (total < 0 || completed < 0 || failed < 0 || completed + failed > total) {
            throw new IllegalArgumentException(
                "Invalid progress: total=" + total + ", completed=" + completed + ", failed=" + failed);
        }
        this.total = total;
        this.completed = completed;
        this.failed = failed;
    }

    public static RunProgress initial(int total) {
        return new RunProgress(total, 0, 0);
    }

    public static RunProgress of(int total, int completed, int failed) {
        return new RunProgress(total, completed, failed);
    }

    public int getTotal() {
        return total;
    }

    public int getCompleted() {
        return completed;
    }

    public int getFailed() {
        return failed;
    }

    public int done() {
        return completed + failed;
    }

    public boolean isFinished() {
        return done() >= total;
    }

    public int percentComplete() {
        if (total == 0) {
            return 100;
        }
        return (int) Math.round(done() * 100.0 / total);
    }
}
