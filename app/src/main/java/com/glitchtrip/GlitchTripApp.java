package com.glitchtrip;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;

import javax.swing.SwingUtilities;

public class GlitchTripApp
{

	public static void main(String[] args)
	{
		FlatMacDarkLaf.setup();
		ConfigManager configManager = ConfigManager.forUserHome();
		AppConfig config = configManager.load();
		SwingUtilities.invokeLater(() -> {
			MainFrame frame = new MainFrame(configManager, config);
			frame.setVisible(true);
		});
	}
}
