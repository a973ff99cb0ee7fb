package com.glitchtrip;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JComboBox;
import javax.swing.JFileChooser;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JSeparator;
import javax.swing.JSlider;
import javax.swing.JSpinner;
import javax.swing.SpinnerNumberModel;
import javax.swing.SwingWorker;
import javax.swing.UIManager;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.awt.GridBagConstraints;
import java.awt.GridBagLayout;
import java.awt.GridLayout;
import java.awt.Insets;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Random;

public class MainFrame extends JFrame
{

	private static final Logger LOG = LoggerFactory.getLogger(MainFrame.class);

	private final AppConfig config;

	private final PreviewPanel previewPanel = new PreviewPanel();
	private final JLabel statusLabel = new JLabel("No image loaded");
	private final JPanel presetRow = new JPanel(new FlowLayout(FlowLayout.LEFT, 4, 0));
	private final JComboBox<ExportFormat> formatCombo = new JComboBox<>(ExportFormat.values());
	private final JButton glitchButton = new JButton("Glitch!");
	private final JButton undoButton = new JButton("Undo");
	private final JButton redoButton = new JButton("Redo");
	private final JButton recordButton = new JButton("Start");
	private final JSpinner framesSpinner;
	private final JLabel unlockLabel = new JLabel(" ");

	private final ParamSlider rgbShift = new ParamSlider("RGB Split", 0f, 30f);
	private final ParamSlider blockJitter = new ParamSlider("Block Jitter", 0f, 40f);
	private final ParamSlider noise = new ParamSlider("Noise", 0f, 0.6f);
	private final ParamSlider scanlines = new ParamSlider("Scanlines", 0f, 1f);
	private final ParamSlider waveAmp = new ParamSlider("Wave Amp", 0f, 40f);
	private final ParamSlider waveFreq = new ParamSlider("Wave Freq", 0f, 40f);
	private final ParamSlider pixelSort = new ParamSlider("Pixel Sort", 0f, 1f);
	private final ParamSlider aberration = new ParamSlider("Aberration", 0f, 1f);
	private final ParamSlider crush = new ParamSlider("Crush (contrast)", 0f, 1f);
	private final ParamSlider saturation = new ParamSlider("Saturation", 0f, 2f);
	private final ParamSlider hue = new ParamSlider("Hue Shift", -180f, 180f);
	private final ParamSlider brightness = new ParamSlider("Brightness", -0.5f, 0.5f);

	private final EditHistory<PixelBuffer> history = new EditHistory<>();
	private final UnlockSequence unlock = new UnlockSequence();
	private final Random random = new Random();
	private FrameRecorder recorder;

	private PixelBuffer source;
	private PixelBuffer output;
	private File sourceFile;
	private SwingWorker<?, ?> activeWorker;

	public MainFrame(ConfigManager configManager, AppConfig config)
	{
		super("GlitchTrip");
		this.config = config;
		setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
		setMinimumSize(new Dimension(900, 640));

		JPanel controlPanel = new JPanel(new GridBagLayout());
		controlPanel.setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));
		GridBagConstraints gbc = new GridBagConstraints();
		gbc.insets = new Insets(3, 4, 3, 4);
		gbc.fill = GridBagConstraints.HORIZONTAL;
		gbc.gridx = 0;
		gbc.weightx = 1.0;
		int row = 0;

		// File actions
		JPanel fileRow = new JPanel(new GridLayout(1, 3, 4, 0));
		JButton loadButton = new JButton("Load...");
		loadButton.addActionListener(e -> loadImage());
		JButton saveButton = new JButton("Save");
		saveButton.addActionListener(e -> quickSave());
		JButton saveAsButton = new JButton("Save As...");
		saveAsButton.addActionListener(e -> saveAs());
		fileRow.add(loadButton);
		fileRow.add(saveButton);
		fileRow.add(saveAsButton);
		gbc.gridy = row++;
		controlPanel.add(fileRow, gbc);

		gbc.gridy = row++;
		controlPanel.add(new JSeparator(), gbc);

		// Presets
		gbc.gridy = row++;
		controlPanel.add(new JLabel("Presets"), gbc);
		rebuildPresetRow();
		gbc.gridy = row++;
		controlPanel.add(presetRow, gbc);

		JPanel randomRow = new JPanel(new GridLayout(1, 2, 4, 0));
		JButton randomizeButton = new JButton("Randomize");
		randomizeButton.addActionListener(e -> applyPreset(Preset.random(random)));
		JButton resetButton = new JButton("Reset");
		resetButton.addActionListener(e -> applyPreset(Preset.DEFAULTS));
		randomRow.add(randomizeButton);
		randomRow.add(resetButton);
		gbc.gridy = row++;
		controlPanel.add(randomRow, gbc);

		// Sliders
		for (ParamSlider slider : sliders())
		{
			gbc.gridy = row++;
			controlPanel.add(slider, gbc);
		}

		gbc.gridy = row++;
		controlPanel.add(new JSeparator(), gbc);

		// Export format
		JPanel formatRow = new JPanel(new BorderLayout(8, 0));
		formatRow.add(new JLabel("Export:"), BorderLayout.WEST);
		formatCombo.setSelectedItem(config.getExportFormat());
		formatCombo.addActionListener(e -> config.setExportFormat((ExportFormat) formatCombo.getSelectedItem()));
		formatRow.add(formatCombo, BorderLayout.CENTER);
		gbc.gridy = row++;
		controlPanel.add(formatRow, gbc);

		// Undo / redo / glitch
		JPanel actionRow = new JPanel(new GridLayout(1, 3, 4, 0));
		undoButton.addActionListener(e -> undo());
		redoButton.addActionListener(e -> redo());
		glitchButton.addActionListener(e -> runGlitch());
		actionRow.add(undoButton);
		actionRow.add(redoButton);
		actionRow.add(glitchButton);
		gbc.gridy = row++;
		controlPanel.add(actionRow, gbc);

		// Recorder
		JPanel recorderRow = new JPanel(new FlowLayout(FlowLayout.LEFT, 4, 0));
		recorderRow.add(new JLabel("Recorder:"));
		recordButton.addActionListener(e -> toggleRecording());
		recorderRow.add(recordButton);
		framesSpinner = new JSpinner(new SpinnerNumberModel(
				FrameRecorder.clampFrames(config.getRecorderFrames()),
				FrameRecorder.MIN_FRAMES, FrameRecorder.MAX_FRAMES, 10));
		framesSpinner.addChangeListener(e -> config.setRecorderFrames((Integer) framesSpinner.getValue()));
		recorderRow.add(new JLabel("Frames:"));
		recorderRow.add(framesSpinner);
		gbc.gridy = row++;
		controlPanel.add(recorderRow, gbc);

		gbc.gridy = row++;
		controlPanel.add(statusLabel, gbc);

		gbc.gridy = row++;
		controlPanel.add(new JSeparator(), gbc);

		// Secret keypad
		gbc.gridy = row++;
		controlPanel.add(new JLabel("Secret Input (just for fun):"), gbc);
		JPanel keypad = new JPanel(new GridLayout(2, 3, 2, 2));
		for (char key : UnlockSequence.KEYS.toCharArray())
		{
			JButton b = new JButton(String.valueOf(key));
			b.setMargin(new Insets(1, 1, 1, 1));
			b.addActionListener(e -> onSecretKey(key));
			keypad.add(b);
		}
		gbc.gridy = row++;
		controlPanel.add(keypad, gbc);
		gbc.gridy = row++;
		controlPanel.add(unlockLabel, gbc);

		// Spacer
		gbc.gridy = row;
		gbc.weighty = 1.0;
		controlPanel.add(new JPanel(), gbc);

		previewPanel.setOnAttractorsChanged(points -> {
			if (source != null) runGlitch();
		});

		setLayout(new BorderLayout());
		add(previewPanel, BorderLayout.CENTER);
		JScrollPane controlScroll = new JScrollPane(controlPanel,
				JScrollPane.VERTICAL_SCROLLBAR_AS_NEEDED,
				JScrollPane.HORIZONTAL_SCROLLBAR_NEVER);
		controlScroll.setPreferredSize(new Dimension(360, 0));
		controlScroll.setBorder(BorderFactory.createMatteBorder(0, 1, 0, 0,
				UIManager.getColor("Separator.foreground")));
		add(controlScroll, BorderLayout.EAST);

		addWindowListener(new WindowAdapter()
		{
			@Override
			public void windowClosing(WindowEvent e)
			{
				configManager.save(config);
			}
		});

		applyPreset(Preset.DEFAULTS);
		updateButtons();

		pack();
		setSize(1280, 900);
		setLocationRelativeTo(null);
	}

	private List<ParamSlider> sliders()
	{
		return List.of(rgbShift, blockJitter, noise, scanlines, waveAmp, waveFreq,
				pixelSort, aberration, crush, saturation, hue, brightness);
	}

	private void rebuildPresetRow()
	{
		presetRow.removeAll();
		for (Preset preset : Preset.available(unlock.isUnlocked()))
		{
			JButton b = new JButton(preset.name());
			b.addActionListener(e -> applyPreset(preset));
			presetRow.add(b);
		}
		presetRow.revalidate();
		presetRow.repaint();
	}

	private void applyPreset(Preset p)
	{
		rgbShift.setValue(p.rgbShift());
		blockJitter.setValue(p.blockJitter());
		noise.setValue(p.noise());
		scanlines.setValue(p.scanlines());
		waveAmp.setValue(p.waveAmp());
		waveFreq.setValue(p.waveFreq());
		pixelSort.setValue(p.pixelSort());
		aberration.setValue(p.aberration());
		crush.setValue(p.crush());
		saturation.setValue(p.saturation());
		hue.setValue(p.hue());
		brightness.setValue(p.brightness());
		previewPanel.setAttractors(p.attractors());
	}

	private GlitchParameters currentParameters()
	{
		return GlitchParameters.builder()
				.rgbShiftPixels(rgbShift.getValue())
				.blockJitterSize(Math.round(blockJitter.getValue()))
				.noiseAmount(noise.getValue())
				.scanlineStrength(scanlines.getValue())
				.waveAmplitude(waveAmp.getValue())
				.waveFrequency(waveFreq.getValue())
				.pixelSortAmount(pixelSort.getValue())
				.aberrationStrength(aberration.getValue())
				.contrastCrush(crush.getValue())
				.saturation(saturation.getValue())
				.hueDegrees(hue.getValue())
				.brightnessOffset(brightness.getValue())
				.attractors(previewPanel.getAttractors())
				.boostMode(unlock.isUnlocked())
				.build();
	}

	private void onSecretKey(char key)
	{
		if (unlock.press(key))
		{
			unlockLabel.setText("Spam Mode unlocked! Extra preset + pink bias active.");
			rebuildPresetRow();
			LOG.info("Boost mode unlocked");
		}
	}

	private void updateButtons()
	{
		glitchButton.setEnabled(source != null);
		undoButton.setEnabled(history.canUndo());
		redoButton.setEnabled(history.canRedo());
		recordButton.setText(recorder != null && recorder.isRecording() ? "Stop" : "Start");
		if (recorder != null && recorder.isRecording())
		{
			glitchButton.setText("Glitch (REC " + recorder.framesWritten() + "/" + recorder.targetFrames() + ")");
		}
		else
		{
			glitchButton.setText("Glitch!");
		}
	}

	private File lastDirectory()
	{
		return config.getLastDirectory() != null ? new File(config.getLastDirectory()) : null;
	}

	private void loadImage()
	{
		JFileChooser chooser = new JFileChooser();
		chooser.setFileSelectionMode(JFileChooser.FILES_ONLY);
		chooser.setDialogTitle("Pick an image");
		chooser.setFileFilter(new FileNameExtensionFilter(
				"Images (PNG, JPEG, WebP, GIF, BMP)", "png", "jpg", "jpeg", "webp", "gif", "bmp"));
		if (lastDirectory() != null)
		{
			chooser.setCurrentDirectory(lastDirectory());
		}
		if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) return;

		File file = chooser.getSelectedFile();
		config.setLastDirectory(file.getParent());

		new SwingWorker<ImageLoader.LoadResult, Void>()
		{
			@Override
			protected ImageLoader.LoadResult doInBackground() throws Exception
			{
				return ImageLoader.load(file);
			}

			@Override
			protected void done()
			{
				try
				{
					ImageLoader.LoadResult result = get();
					source = result.pixels();
					sourceFile = file;
					output = null;
					history.clear();
					previewPanel.setImage(source.toImage());
					statusLabel.setText(file.getName() + " - " + source.width() + "x" + source.height()
							+ " (" + result.formatName() + ")");
					updateButtons();
				}
				catch (Exception ex)
				{
					showFailure("Load Error", ex);
				}
			}
		}.execute();
	}

	private void runGlitch()
	{
		if (source == null) return;
		if (activeWorker != null)
		{
			activeWorker.cancel(true);
			activeWorker = null;
		}

		PixelBuffer input = source;
		GlitchParameters params = currentParameters();
		int budget = config.getMaxWorkingWidth();
		FrameRecorder rec = recorder != null && recorder.isRecording() ? recorder : null;
		statusLabel.setText("Glitching...");

		SwingWorker<PixelBuffer, Void> worker = new SwingWorker<>()
		{
			@Override
			protected PixelBuffer doInBackground() throws Exception
			{
				PixelBuffer result = GlitchEngine.applyAll(input, params, budget);
				if (rec != null && !isCancelled())
				{
					rec.record(result);
				}
				return result;
			}

			@Override
			protected void done()
			{
				if (isCancelled()) return;
				try
				{
					PixelBuffer result = get();
					if (output != null)
					{
						history.push(output);
					}
					output = result;
					previewPanel.setImage(result.toImage());
					statusLabel.setText("Glitched " + result.width() + "x" + result.height());
				}
				catch (Exception ex)
				{
					showFailure("Glitch Error", ex);
				}
				if (activeWorker == this) activeWorker = null;
				updateButtons();
			}
		};
		activeWorker = worker;
		worker.execute();
	}

	private void undo()
	{
		PixelBuffer previous = history.undo(output);
		if (previous == null) return;
		output = previous;
		previewPanel.setImage(previous.toImage());
		updateButtons();
	}

	private void redo()
	{
		PixelBuffer next = history.redo(output);
		if (next == null) return;
		output = next;
		previewPanel.setImage(next.toImage());
		updateButtons();
	}

	private void toggleRecording()
	{
		if (recorder != null && recorder.isRecording())
		{
			recorder.stop();
		}
		else
		{
			File dir = lastDirectory() != null ? lastDirectory() : new File(System.getProperty("user.home"));
			recorder = new FrameRecorder(dir);
			recorder.start((Integer) framesSpinner.getValue());
		}
		updateButtons();
	}

	private PixelBuffer imageToSave()
	{
		return output != null ? output : source;
	}

	private void quickSave()
	{
		PixelBuffer image = imageToSave();
		if (image == null) return;
		ExportFormat format = (ExportFormat) formatCombo.getSelectedItem();
		File dir = lastDirectory() != null ? lastDirectory()
				: sourceFile != null ? sourceFile.getParentFile() : new File(System.getProperty("user.home"));
		export(image, new File(dir, ImageExporter.exportFileName(format, System.currentTimeMillis())), format);
	}

	private void saveAs()
	{
		PixelBuffer image = imageToSave();
		if (image == null) return;
		ExportFormat format = (ExportFormat) formatCombo.getSelectedItem();

		JFileChooser chooser = new JFileChooser();
		chooser.setDialogTitle("Save glitched image");
		chooser.setFileFilter(new FileNameExtensionFilter(format.name() + " files", format.extension()));
		if (lastDirectory() != null)
		{
			chooser.setCurrentDirectory(lastDirectory());
		}
		chooser.setSelectedFile(new File(ImageExporter.exportFileName(format, System.currentTimeMillis())));
		if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) return;

		File target = chooser.getSelectedFile();
		if (ExportFormat.fromFileName(target.getName()) != format
				|| !target.getName().contains("."))
		{
			target = new File(target.getAbsolutePath() + "." + format.extension());
		}
		config.setLastDirectory(target.getParent());
		export(image, target, format);
	}

	private void export(PixelBuffer image, File target, ExportFormat format)
	{
		new SwingWorker<Void, Void>()
		{
			@Override
			protected Void doInBackground() throws IOException
			{
				ImageExporter.write(image, target, format);
				return null;
			}

			@Override
			protected void done()
			{
				try
				{
					get();
					statusLabel.setText("Saved " + target.getName());
				}
				catch (Exception ex)
				{
					showFailure("Export Error", ex);
				}
			}
		}.execute();
	}

	private void showFailure(String title, Exception ex)
	{
		Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
		LOG.error("{}: {}", title, cause.getMessage(), cause);
		if (cause instanceof OutOfMemoryError)
		{
			JOptionPane.showMessageDialog(this,
					"Not enough memory for this image.\n"
							+ "Increase the -Xmx value in the launcher or JVM arguments.",
					"Out of Memory", JOptionPane.ERROR_MESSAGE);
		}
		else
		{
			JOptionPane.showMessageDialog(this, cause.getMessage(), title, JOptionPane.ERROR_MESSAGE);
		}
		statusLabel.setText(title);
	}

	// --- Labelled float slider ---

	private static final class ParamSlider extends JPanel
	{
		private static final int STEPS = 1000;

		private final String label;
		private final float min;
		private final float max;
		private final JLabel title = new JLabel();
		private final JSlider slider = new JSlider(0, STEPS, 0);

		ParamSlider(String label, float min, float max)
		{
			super(new BorderLayout());
			this.label = label;
			this.min = min;
			this.max = max;
			add(title, BorderLayout.NORTH);
			add(slider, BorderLayout.CENTER);
			slider.addChangeListener(e -> refreshTitle());
			refreshTitle();
		}

		float getValue()
		{
			return min + (max - min) * slider.getValue() / STEPS;
		}

		void setValue(float value)
		{
			float clamped = Math.max(min, Math.min(max, value));
			slider.setValue(Math.round((clamped - min) / (max - min) * STEPS));
		}

		private void refreshTitle()
		{
			title.setText(String.format("%s: %.2f", label, getValue()));
		}
	}
}
