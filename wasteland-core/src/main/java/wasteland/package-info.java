/**
 * Mutation engine for the federated wanted board.
 *
 * <h2>Core Design</h2>
 * <p>Each rig holds a fork of the shared commons database. A {@link wasteland.WastelandClient}
 * turns an intent such as "claim this item" into a guarded state transition
 * ({@link wasteland.lifecycle.Transition}) and commits it either straight to main
 * ({@link wasteland.Mode#WILD_WEST}) or to the rig's per-item branch
 * {@code wl/{rig}/{wantedId}} ({@link wasteland.Mode#PR}). Reads reconcile main with the
 * rig's branch through {@link wasteland.resolve.BranchStateResolver}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>wasteland-core</b>: model, transitions, engine, store SPI (depends only on ulid-creator)</li>
 *   <li><b>wasteland-jdbc</b>: Dolt and embedded H2 implementations of
 *       {@link wasteland.spi.CommonsStore}</li>
 *   <li><b>wasteland-micrometer</b>: Micrometer {@link wasteland.spi.MetricsExporter}</li>
 *   <li><b>wasteland-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * CommonsStore store = JdbcCommonsStores.detect(dataSource);
 * WastelandClient alice = new WastelandClient(ClientConfig.builder()
 *     .store(store)
 *     .rigHandle("alice")
 *     .mode(Mode.PR)
 *     .build());
 *
 * MutationResult posted = alice.post(PostInput.builder("Fix bug").build());
 * MutationResult claimed = alice.claim(posted.detail().item().id());
 * alice.applyBranch(claimed.branch());
 * }</pre>
 *
 * @see wasteland.WastelandClient
 * @see wasteland.Workspace
 * @see wasteland.spi.CommonsStore
 */
package wasteland;
