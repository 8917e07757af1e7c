package dev.vct.testunit.runner;

public enum RunState {
	IDLE,
	EXECUTING,
	COMPLETED,
}
