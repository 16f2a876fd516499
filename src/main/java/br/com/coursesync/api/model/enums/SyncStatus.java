package br.com.coursesync.api.model.enums;

public enum SyncStatus {
    PENDING,                 // Tarefa criada, aguardando início
    PROCESSING,              // Diff calculado, aplicando operações
    COMPLETED,               // Todas as operações aplicadas
    COMPLETED_WITH_FAILURES, // Lote aplicado parcialmente; ver failedOperations
    FAILED                   // Erro fatal, transação desfeita
}
