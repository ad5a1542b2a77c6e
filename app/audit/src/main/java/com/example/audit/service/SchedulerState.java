package com.example.audit.service;

public enum SchedulerState {
  IDLE,
  RUNNING
}
